package io.github.drompincen.taskboard.persistence.document;

import io.github.drompincen.taskboard.protocol.api.Team;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One entry of a team's status vocabulary. The id is the column id, {@code <team>_<code>}.
 */
@Document(collection = "statuses")
@CompoundIndex(name = "team_code", def = "{'team': 1, 'code': 1}", unique = true)
public class StatusDefinitionDocument {

    @Id
    private String id;
    private Team team;
    private String code;
    private String name;
    private String color;
    private int position;
    private Instant createdAt;

    public StatusDefinitionDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public Team getTeam() { return team; }
    public void setTeam(Team team) { this.team = team; }

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    public int getPosition() { return position; }
    public void setPosition(int position) { this.position = position; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
