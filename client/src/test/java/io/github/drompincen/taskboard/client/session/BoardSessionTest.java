package io.github.drompincen.taskboard.client.session;

import io.github.drompincen.taskboard.engine.backend.FailureKind;
import io.github.drompincen.taskboard.engine.board.BoardColumn;
import io.github.drompincen.taskboard.engine.support.FakeTaskBoardBackend;
import io.github.drompincen.taskboard.engine.support.ManualBoardScheduler;
import io.github.drompincen.taskboard.engine.sync.MoveOutcome;
import io.github.drompincen.taskboard.protocol.api.CreateTaskRequest;
import io.github.drompincen.taskboard.protocol.api.TaskDto;
import io.github.drompincen.taskboard.protocol.api.TaskFilter;
import io.github.drompincen.taskboard.protocol.api.Team;
import io.github.drompincen.taskboard.protocol.api.UserDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static io.github.drompincen.taskboard.engine.support.BoardFixtures.admin;
import static io.github.drompincen.taskboard.engine.support.BoardFixtures.creativeStatuses;
import static io.github.drompincen.taskboard.engine.support.BoardFixtures.employee;
import static io.github.drompincen.taskboard.engine.support.BoardFixtures.status;
import static io.github.drompincen.taskboard.engine.support.BoardFixtures.task;
import static org.assertj.core.api.Assertions.assertThat;

class BoardSessionTest {

    private static final Duration POLL = Duration.ofSeconds(3);
    private static final Duration DEBOUNCE = Duration.ofSeconds(1);

    private FakeTaskBoardBackend backend;
    private ManualBoardScheduler scheduler;
    private List<List<BoardColumn>> published;

    @BeforeEach
    void setUp() {
        backend = new FakeTaskBoardBackend();
        backend.givenStatuses(Team.CREATIVE, creativeStatuses());
        backend.givenStatuses(Team.WEB, List.of(status(Team.WEB, "qa", 0), status(Team.WEB, "live", 1)));
        scheduler = new ManualBoardScheduler();
        published = new ArrayList<>();
    }

    private BoardSession openSession(UserDto user, List<TaskDto> tasks) {
        BoardSession session = new BoardSession(backend, scheduler, user, POLL, DEBOUNCE);
        session.subscribeColumns(published::add);
        session.open(TaskFilter.forTeam(Team.CREATIVE));
        scheduler.runPending();
        backend.lastFetch().answer(tasks);
        scheduler.runPending();
        return session;
    }

    @Test
    void openProjectsVocabularyAndFetchedTasks() {
        BoardSession session = openSession(admin(Team.CREATIVE), List.of(task("t1", Team.CREATIVE, "review")));

        assertThat(session.columns()).extracting(BoardColumn::columnId)
                .containsExactly("creative_backlog", "creative_in_progress", "creative_review", "creative_done");
        assertThat(session.columns().get(2).tasks()).extracting(TaskDto::taskId).containsExactly("t1");
    }

    @Test
    void identicalPollDoesNotRepublishColumns() {
        openSession(admin(Team.CREATIVE), List.of(task("t1", Team.CREATIVE, "review")));
        int before = published.size();

        scheduler.advance(POLL);
        backend.lastFetch().answer(List.of(task("t1", Team.CREATIVE, "review")));
        scheduler.runPending();

        assertThat(published).hasSize(before);
    }

    @Test
    void moveShowsImmediatelyAndRefreshesAfterCommit() {
        BoardSession session = openSession(admin(Team.CREATIVE), List.of(task("t1", Team.CREATIVE, "backlog")));
        int fetchesBefore = backend.fetches.size();

        CompletableFuture<MoveOutcome> outcome = session.requestMove("t1", "creative_done");
        scheduler.runPending();

        assertThat(session.columns().get(3).tasks()).extracting(TaskDto::taskId).containsExactly("t1");
        assertThat(outcome).isNotDone();

        backend.lastStatusUpdate().succeed(task("t1", Team.CREATIVE, "done"));
        scheduler.runPending();
        assertThat(outcome.join().result()).isEqualTo(MoveOutcome.Result.COMMITTED);

        scheduler.advance(DEBOUNCE);
        assertThat(backend.fetches.size()).isGreaterThan(fetchesBefore);
    }

    @Test
    void employeeSeesAllColumnsButMovesOnlyIntoAllowed() {
        UserDto user = employee("u1", Team.CREATIVE, "backlog", "in_progress");
        BoardSession session = openSession(user, List.of(task("t1", Team.CREATIVE, "backlog")));

        assertThat(session.columns()).hasSize(4);
        assertThat(session.canMoveInto("creative_in_progress")).isTrue();
        assertThat(session.canMoveInto("creative_review")).isFalse();
        assertThat(session.canCreateIn("backlog")).isTrue();
        assertThat(session.canCreateIn("done")).isFalse();

        MoveOutcome outcome = moveAndSettle(session, "t1", "creative_review");
        assertThat(outcome.reason()).isEqualTo("PERMISSION_DENIED");
        assertThat(backend.statusUpdates).isEmpty();
    }

    @Test
    void changingTeamReloadsVocabulary() {
        BoardSession session = openSession(admin(Team.CREATIVE), List.of(task("t1", Team.CREATIVE, "backlog")));

        session.changeScope(TaskFilter.forTeam(Team.WEB));
        scheduler.runPending();
        assertThat(session.columns()).extracting(BoardColumn::columnId).containsExactly("web_qa", "web_live");
        assertThat(session.columns()).allSatisfy(c -> assertThat(c.tasks()).isEmpty());

        scheduler.advance(DEBOUNCE);
        assertThat(backend.lastFetch().filter().team()).isEqualTo(Team.WEB);
        backend.lastFetch().answer(List.of(task("w1", Team.WEB, "live")));
        scheduler.runPending();

        assertThat(session.columns().get(1).tasks()).extracting(TaskDto::taskId).containsExactly("w1");
    }

    @Test
    void failedVocabularyLoadIsRetriedAfterNextPoll() {
        backend.failNextStatusDefinitions(FailureKind.NETWORK_FAILURE);
        BoardSession session = new BoardSession(backend, scheduler, admin(Team.CREATIVE), POLL, DEBOUNCE);
        session.open(TaskFilter.forTeam(Team.CREATIVE));
        scheduler.runPending();

        assertThat(session.columns()).isEmpty();
        assertThat(backend.statusDefinitionRequests()).isEqualTo(1);

        backend.lastFetch().fail(FailureKind.NETWORK_FAILURE);
        scheduler.runPending();

        assertThat(backend.statusDefinitionRequests()).isEqualTo(2);
        assertThat(session.columns()).hasSize(4);

        scheduler.advance(POLL);
        backend.lastFetch().answer(List.of(task("t1", Team.CREATIVE, "done")));
        scheduler.runPending();

        assertThat(session.columns().get(3).tasks()).extracting(TaskDto::taskId).containsExactly("t1");
        assertThat(backend.statusDefinitionRequests()).isEqualTo(2);
    }

    @Test
    void moveInFlightSurvivesTeamChangeAndStillRollsBack() {
        BoardSession session = openSession(admin(Team.CREATIVE), List.of(
                task("t1", Team.CREATIVE, "backlog"), task("t2", Team.CREATIVE, "review")));
        CompletableFuture<MoveOutcome> outcome = session.requestMove("t1", "creative_done");
        scheduler.runPending();

        session.changeScope(TaskFilter.forTeam(Team.WEB));
        scheduler.runPending();

        assertThat(session.snapshot().find("t1")).map(TaskDto::status).contains("done");
        assertThat(session.snapshot().find("t2")).isEmpty();
        assertThat(session.snapshot().isInFlight("t1")).isTrue();

        backend.lastStatusUpdate().fail(FailureKind.NETWORK_FAILURE);
        scheduler.runPending();

        assertThat(outcome.join().result()).isEqualTo(MoveOutcome.Result.ROLLED_BACK);
        assertThat(session.snapshot().find("t1")).map(TaskDto::status).contains("backlog");
        assertThat(session.snapshot().isInFlight("t1")).isFalse();
        assertThat(session.columns()).extracting(BoardColumn::columnId).containsExactly("web_qa", "web_live");
    }

    @Test
    void createIsRefusedLocallyWithoutRights() {
        BoardSession session = openSession(employee("u1", Team.CREATIVE, "backlog"), List.of());

        CompletableFuture<TaskDto> result = session.createTask(
                new CreateTaskRequest("Shoot", null, "done", null, null, null, null, "u1"));
        scheduler.runPending();

        assertThat(result).isCompletedExceptionally();
        assertThat(backend.creates).isEmpty();
    }

    @Test
    void createdTaskAppearsWithoutWaitingForPoll() {
        BoardSession session = openSession(employee("u1", Team.CREATIVE, "backlog"), List.of());

        CompletableFuture<TaskDto> result = session.createTask(
                new CreateTaskRequest("Shoot", null, null, null, null, null, null, "u1"));
        scheduler.runPending();
        assertThat(backend.creates).hasSize(1);

        backend.creates.get(0).future().complete(task("t9", Team.CREATIVE, "backlog"));
        scheduler.runPending();

        assertThat(result.join().taskId()).isEqualTo("t9");
        assertThat(session.columns().get(0).tasks()).extracting(TaskDto::taskId).containsExactly("t9");
    }

    @Test
    void closeStopsPolling() {
        BoardSession session = openSession(admin(Team.CREATIVE), List.of());
        int fetches = backend.fetches.size();

        session.close();
        scheduler.advance(POLL.multipliedBy(3));

        assertThat(backend.fetches).hasSize(fetches);
    }

    private MoveOutcome moveAndSettle(BoardSession session, String taskId, String columnId) {
        CompletableFuture<MoveOutcome> outcome = session.requestMove(taskId, columnId);
        scheduler.runPending();
        return outcome.join();
    }
}
