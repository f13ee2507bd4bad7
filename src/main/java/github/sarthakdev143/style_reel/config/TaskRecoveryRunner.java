package github.sarthakdev143.style_reel.config;

import github.sarthakdev143.style_reel.service.TaskService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1)
public class TaskRecoveryRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(TaskRecoveryRunner.class);

    private final TaskService taskService;

    public TaskRecoveryRunner(TaskService taskService) {
        this.taskService = taskService;
    }

    @Override
    public void run(ApplicationArguments args) {
        int recovered = taskService.recoverInterruptedTasks();
        if (recovered > 0) {
            logger.info("Recovered {} tasks left unfinished by a previous run", recovered);
        }
    }
}
