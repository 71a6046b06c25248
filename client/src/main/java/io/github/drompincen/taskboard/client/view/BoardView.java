package io.github.drompincen.taskboard.client.view;

import io.github.drompincen.taskboard.client.session.BoardSession;
import io.github.drompincen.taskboard.engine.board.BoardColumn;
import io.github.drompincen.taskboard.engine.sync.SyncStatus;
import io.github.drompincen.taskboard.protocol.api.TaskDto;
import io.github.drompincen.taskboard.protocol.api.TaskFilter;
import io.github.drompincen.taskboard.protocol.api.Team;
import io.github.drompincen.taskboard.protocol.event.BoardEvent;
import org.springframework.stereotype.Component;

import javax.swing.*;
import java.awt.*;
import java.util.List;

/**
 * Columns of the active team, one card per task. Moves are offered through each card's popup menu;
 * the board itself only changes when the session publishes new columns.
 */
@Component
public class BoardView extends JPanel {

    private final BoardSession session;
    private final JPanel columnsPanel = new JPanel(new GridLayout(1, 0, 8, 0));
    private final JLabel statusLabel = new JLabel(" ");
    private final JTextField searchField = new JTextField(20);
    private final JComboBox<Team> teamBox = new JComboBox<>(Team.values());
    private List<BoardColumn> rendered = List.of();

    public BoardView(BoardSession session) {
        this.session = session;

        setLayout(new BorderLayout(0, 8));
        setBorder(BorderFactory.createEmptyBorder(8, 8, 8, 8));
        add(createToolbar(), BorderLayout.NORTH);
        add(new JScrollPane(columnsPanel), BorderLayout.CENTER);
        add(statusLabel, BorderLayout.SOUTH);

        session.subscribeColumns(columns -> SwingUtilities.invokeLater(() -> render(columns)));
        session.subscribeEvents(event -> SwingUtilities.invokeLater(() -> showEvent(event)));
        session.subscribeSync(status -> SwingUtilities.invokeLater(() -> showSync(status)));
    }

    private JPanel createToolbar() {
        JPanel toolbar = new JPanel(new FlowLayout(FlowLayout.LEFT, 6, 0));
        teamBox.setSelectedItem(session.user().team());
        teamBox.setEnabled(session.user().isAdmin());
        teamBox.addActionListener(e -> applyScope());
        searchField.addActionListener(e -> applyScope());
        toolbar.add(new JLabel("Team"));
        toolbar.add(teamBox);
        toolbar.add(new JLabel("Search"));
        toolbar.add(searchField);
        return toolbar;
    }

    private void applyScope() {
        Team team = (Team) teamBox.getSelectedItem();
        if (team == null) return;
        session.changeScope(TaskFilter.forTeam(team).withSearchQuery(searchField.getText()));
    }

    void render(List<BoardColumn> columns) {
        rendered = columns;
        columnsPanel.removeAll();
        for (BoardColumn column : columns) {
            columnsPanel.add(createColumn(column));
        }
        columnsPanel.revalidate();
        columnsPanel.repaint();
    }

    private JPanel createColumn(BoardColumn column) {
        JPanel panel = new JPanel();
        panel.setLayout(new BoxLayout(panel, BoxLayout.Y_AXIS));
        panel.setBorder(BorderFactory.createCompoundBorder(
                BorderFactory.createLineBorder(UIManager.getColor("Component.borderColor"), 1),
                BorderFactory.createEmptyBorder(8, 8, 8, 8)));
        panel.putClientProperty("columnId", column.columnId());

        JLabel header = new JLabel(column.name() + " (" + column.count() + ")");
        header.setFont(header.getFont().deriveFont(Font.BOLD));
        header.setAlignmentX(LEFT_ALIGNMENT);
        panel.add(header);
        panel.add(Box.createVerticalStrut(8));

        Color accent = parseColor(column.color());
        for (TaskDto task : column.tasks()) {
            panel.add(createCard(task, column, accent));
            panel.add(Box.createVerticalStrut(4));
        }
        panel.add(Box.createVerticalGlue());
        return panel;
    }

    private JLabel createCard(TaskDto task, BoardColumn current, Color accent) {
        JLabel card = new JLabel(task.title());
        card.setAlignmentX(LEFT_ALIGNMENT);
        card.setMaximumSize(new Dimension(Integer.MAX_VALUE, 40));
        card.setBorder(BorderFactory.createCompoundBorder(
                BorderFactory.createMatteBorder(0, 3, 0, 0, accent),
                BorderFactory.createEmptyBorder(6, 8, 6, 8)));
        if (session.snapshot().isInFlight(task.taskId())) {
            card.setEnabled(false);
        }
        card.putClientProperty("taskId", task.taskId());
        card.setComponentPopupMenu(createCardMenu(task, current));
        return card;
    }

    JPopupMenu createCardMenu(TaskDto task, BoardColumn current) {
        JPopupMenu menu = new JPopupMenu();
        JMenu moveTo = new JMenu("Move to");
        for (BoardColumn target : rendered) {
            if (target.columnId().equals(current.columnId())) continue;
            JMenuItem item = new JMenuItem(target.name());
            item.setEnabled(session.canMoveInto(target.columnId()));
            item.addActionListener(e -> session.requestMove(task.taskId(), target.columnId()));
            moveTo.add(item);
        }
        menu.add(moveTo);
        menu.addSeparator();
        JMenuItem delete = new JMenuItem("Delete");
        delete.addActionListener(e -> session.deleteTask(task.taskId())
                .exceptionally(error -> {
                    SwingUtilities.invokeLater(() -> statusLabel.setText("Delete failed: " + error.getMessage()));
                    return null;
                }));
        menu.add(delete);
        return menu;
    }

    void showEvent(BoardEvent event) {
        switch (event.type()) {
            case REJECTED:
                statusLabel.setText("Move to " + event.toStatus() + " refused: " + event.reason());
                break;
            case ROLLED_BACK:
                statusLabel.setText("Move to " + event.toStatus() + " undone: " + event.reason());
                break;
            case COMMITTED:
                statusLabel.setText("Saved");
                break;
            default:
                break;
        }
    }

    void showSync(SyncStatus status) {
        if (!status.healthy()) {
            statusLabel.setText("Sync failing (" + status.consecutiveFailures() + "): " + status.lastError());
        }
    }

    JPanel columnsPanel() {
        return columnsPanel;
    }

    String statusText() {
        return statusLabel.getText();
    }

    private static Color parseColor(String hex) {
        if (hex == null) {
            return new Color(0x00, 0x7A, 0xCC);
        }
        try {
            return Color.decode(hex);
        } catch (NumberFormatException e) {
            return new Color(0x00, 0x7A, 0xCC);
        }
    }
}
