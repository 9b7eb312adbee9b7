package com.chartbot.app;

import com.chartbot.automation.ScheduleService;
import com.chartbot.automation.SchedulerLoop;
import com.chartbot.automation.error.AutomationException;
import com.chartbot.automation.error.ScheduleNotFoundException;
import com.chartbot.model.JobLog;
import com.chartbot.model.JobStatus;
import com.chartbot.model.Schedule;
import com.chartbot.model.TriggerResult;
import com.chartbot.security.CredentialCipher;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Command line entry point. Exit codes: 0 ok, 1 fatal, 2 usage error, 3 schedule busy.
 */
public final class ChartBotApplication {
    private static final Logger LOG = LogManager.getLogger(ChartBotApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_BUSY = 3;

    public static void main(String[] args) {
        int exit = new ChartBotApplication().run(args);
        if (exit != EXIT_OK) {
            System.exit(exit);
        }
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("chartbot", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (cmd.hasOption("help") || args == null || args.length == 0) {
            new HelpFormatter().printHelp("chartbot", options);
            return cmd.hasOption("help") ? EXIT_OK : EXIT_USAGE;
        }
        if ((cmd.hasOption("logs") || cmd.hasOption("schedules")) && !cmd.hasOption("user")) {
            System.err.println("ERROR: --logs and --schedules require --user <userId>.");
            return EXIT_USAGE;
        }

        try (ConfigurableApplicationContext context = startContext()) {
            if (cmd.hasOption("encrypt")) {
                return encrypt(context, cmd.getOptionValue("encrypt"));
            }
            if (cmd.hasOption("trigger")) {
                return trigger(context, cmd.getOptionValue("trigger"));
            }
            if (cmd.hasOption("run-due")) {
                return runDue(context);
            }
            if (cmd.hasOption("logs")) {
                return printLogs(context, cmd);
            }
            if (cmd.hasOption("schedules")) {
                return printSchedules(context, cmd.getOptionValue("user"));
            }
            return runSchedule(context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.info("interrupted, shutting down");
            return EXIT_OK;
        } catch (RuntimeException e) {
            LOG.fatal("chartbot failed: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    ConfigurableApplicationContext startContext() {
        return new SpringApplicationBuilder(ChartBotBootstrapConfig.class)
                .web(WebApplicationType.NONE)
                .logStartupInfo(false)
                .run();
    }

    private int encrypt(ConfigurableApplicationContext context, String value) {
        CredentialCipher cipher = context.getBean(CredentialCipher.class);
        try {
            System.out.println(cipher.seal(value));
            return EXIT_OK;
        } catch (AutomationException e) {
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private int trigger(ConfigurableApplicationContext context, String rawId) {
        long scheduleId;
        try {
            scheduleId = Long.parseLong(rawId.trim());
        } catch (NumberFormatException e) {
            System.err.println("ERROR: --trigger expects a numeric schedule id, got " + rawId);
            return EXIT_USAGE;
        }
        try {
            TriggerResult result = context.getBean(ScheduleService.class).triggerNow(scheduleId);
            System.out.println(result);
            return result.accepted ? EXIT_OK : EXIT_BUSY;
        } catch (ScheduleNotFoundException e) {
            System.err.println("ERROR: schedule not found: " + e.scheduleId());
            return EXIT_USAGE;
        } catch (AutomationException e) {
            System.err.println("ERROR: " + e.shortDetail());
            return EXIT_FATAL;
        }
    }

    private int runDue(ConfigurableApplicationContext context) {
        Map<Long, JobStatus> results = context.getBean(SchedulerLoop.class).runDueNow();
        if (results.isEmpty()) {
            System.out.println("no schedules due");
        }
        for (Map.Entry<Long, JobStatus> entry : results.entrySet()) {
            System.out.println("schedule_id=" + entry.getKey() + " status=" + entry.getValue().label());
        }
        return EXIT_OK;
    }

    private int printLogs(ConfigurableApplicationContext context, CommandLine cmd) {
        Long scheduleId = null;
        int limit = 0;
        try {
            if (cmd.hasOption("schedule-id")) {
                scheduleId = Long.parseLong(cmd.getOptionValue("schedule-id").trim());
            }
            if (cmd.hasOption("limit")) {
                limit = Integer.parseInt(cmd.getOptionValue("limit").trim());
            }
        } catch (NumberFormatException e) {
            System.err.println("ERROR: --schedule-id and --limit must be numbers.");
            return EXIT_USAGE;
        }
        try {
            List<JobLog> logs = context.getBean(ScheduleService.class)
                    .listLogs(cmd.getOptionValue("user"), scheduleId, limit);
            for (JobLog log : logs) {
                System.out.println(formatLog(log));
            }
            return EXIT_OK;
        } catch (AutomationException e) {
            System.err.println("ERROR: " + e.shortDetail());
            return e.jobStatus() == JobStatus.PERSISTENCE_FAILED ? EXIT_FATAL : EXIT_USAGE;
        }
    }

    private int printSchedules(ConfigurableApplicationContext context, String userId) {
        try {
            for (Schedule schedule : context.getBean(ScheduleService.class).listSchedules(userId)) {
                System.out.println(formatSchedule(schedule));
            }
            return EXIT_OK;
        } catch (AutomationException e) {
            System.err.println("ERROR: " + e.shortDetail());
            return e.jobStatus() == JobStatus.PERSISTENCE_FAILED ? EXIT_FATAL : EXIT_USAGE;
        }
    }

    private int runSchedule(ConfigurableApplicationContext context) throws InterruptedException {
        SchedulerLoop loop = context.getBean(SchedulerLoop.class);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            loop.close();
            stopped.countDown();
        }, "chartbot-shutdown"));
        loop.start();
        stopped.await();
        return EXIT_OK;
    }

    static String formatLog(JobLog log) {
        StringBuilder sb = new StringBuilder();
        sb.append("id=").append(log.id)
                .append(" schedule_id=").append(log.scheduleId)
                .append(" trigger=").append(log.trigger)
                .append(" started_at=").append(log.startedAt)
                .append(" status=").append(log.status == null ? "-" : log.status.label())
                .append(" duration_ms=").append(log.durationMs);
        if (log.action != null) {
            sb.append(" action=").append(log.action).append(" confidence=").append(log.confidence);
        }
        if (log.reason != null) {
            sb.append(" reason=").append(log.reason.label());
        }
        sb.append(" telegram_sent=").append(log.telegramSent);
        if (log.error != null) {
            sb.append(" error=").append(log.error);
        }
        return sb.toString();
    }

    static String formatSchedule(Schedule schedule) {
        return "id=" + schedule.id
                + " layout_id=" + schedule.layoutId
                + " enabled=" + schedule.enabled
                + " frequency=" + schedule.frequency.label()
                + " min_confidence=" + schedule.minConfidence
                + " next_run_at=" + schedule.nextRunAt
                + " last_signal=" + (schedule.lastSignal == null ? "-" : schedule.lastSignal);
    }

    static Options buildOptions() {
        Options options = new Options();
        OptionGroup commands = new OptionGroup();
        commands.addOption(Option.builder().longOpt("schedule").desc("run the scheduler loop until interrupted").build());
        commands.addOption(Option.builder().longOpt("run-due").desc("run every due schedule once, then exit").build());
        commands.addOption(Option.builder().longOpt("trigger").hasArg().argName("scheduleId")
                .desc("run one schedule now, waiting for its outcome").build());
        commands.addOption(Option.builder().longOpt("logs").desc("print recent job logs for --user").build());
        commands.addOption(Option.builder().longOpt("schedules").desc("list the schedules owned by --user").build());
        commands.addOption(Option.builder().longOpt("encrypt").hasArg().argName("value")
                .desc("print the credential envelope for a value").build());
        commands.addOption(Option.builder().longOpt("help").desc("show help").build());
        options.addOptionGroup(commands);
        options.addOption(Option.builder().longOpt("user").hasArg().argName("userId").desc("owner of the logs or schedules to print").build());
        options.addOption(Option.builder().longOpt("schedule-id").hasArg().argName("id").desc("limit --logs to one schedule").build());
        options.addOption(Option.builder().longOpt("limit").hasArg().argName("n").desc("max log rows, 1..200 (default 50)").build());
        return options;
    }
}
