package io.github.drompincen.taskboard.client;

import com.formdev.flatlaf.FlatDarkLaf;
import io.github.drompincen.taskboard.client.session.BoardSession;
import io.github.drompincen.taskboard.client.view.BoardView;
import io.github.drompincen.taskboard.protocol.api.TaskFilter;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import javax.swing.*;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.taskboard.client")
public class TaskBoardDesktopApp {

    public static void main(String[] args) {
        FlatDarkLaf.setup();

        UIManager.put("Component.focusWidth", 1);
        UIManager.put("Button.arc", 6);
        UIManager.put("TextComponent.arc", 6);
        UIManager.put("Component.arrowType", "triangle");

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(TaskBoardDesktopApp.class)
                .headless(false)
                .run(args);

        BoardSession session = ctx.getBean(BoardSession.class);
        session.open(TaskFilter.forTeam(session.user().team()));

        SwingUtilities.invokeLater(() -> {
            BoardView boardView = ctx.getBean(BoardView.class);
            JFrame frame = new JFrame("Task Board - " + session.user().name());
            frame.setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
            frame.setContentPane(boardView);
            frame.setSize(1400, 900);
            frame.setLocationRelativeTo(null);
            frame.setVisible(true);

            frame.addWindowListener(new java.awt.event.WindowAdapter() {
                @Override
                public void windowClosing(java.awt.event.WindowEvent e) {
                    ctx.close();
                }
            });
        });
    }
}
