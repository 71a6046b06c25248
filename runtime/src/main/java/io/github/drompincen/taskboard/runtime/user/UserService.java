package io.github.drompincen.taskboard.runtime.user;

import io.github.drompincen.taskboard.persistence.document.UserDocument;
import io.github.drompincen.taskboard.persistence.repository.UserRepository;
import io.github.drompincen.taskboard.protocol.api.Team;
import io.github.drompincen.taskboard.protocol.api.UserDto;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;

@Service
public class UserService {

    private final UserRepository userRepository;

    public UserService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    public Optional<UserDto> findById(String userId) {
        return userRepository.findById(userId).map(UserService::toDto);
    }

    public List<UserDto> listByTeam(Team team) {
        return userRepository.findByTeam(team).stream().map(UserService::toDto).toList();
    }

    public static UserDto toDto(UserDocument doc) {
        Set<String> allowed = doc.getAllowedStatuses() != null ? Set.copyOf(doc.getAllowedStatuses()) : Set.of();
        return new UserDto(doc.getUserId(), doc.getName(), doc.getRole(), doc.getTeam(), doc.isActive(), allowed);
    }
}
