package com.chartbot.app;

import com.chartbot.ai.ChartAnalyzer;
import com.chartbot.ai.ChatModelRegistry;
import com.chartbot.ai.ImpactSummarizer;
import com.chartbot.ai.LangChainChartAnalyzer;
import com.chartbot.ai.LangChainImpactSummarizer;
import com.chartbot.app.properties.CryptoProperties;
import com.chartbot.app.properties.DbProperties;
import com.chartbot.app.properties.SchedulerProperties;
import com.chartbot.app.properties.TelegramProperties;
import com.chartbot.automation.AnalysisStage;
import com.chartbot.automation.AutomationPipeline;
import com.chartbot.automation.CaptureStage;
import com.chartbot.automation.DispatchStage;
import com.chartbot.automation.DueSelector;
import com.chartbot.automation.EnrichmentStage;
import com.chartbot.automation.JobBuilder;
import com.chartbot.automation.JobLogRecorder;
import com.chartbot.automation.NotificationGate;
import com.chartbot.automation.ScheduleGuard;
import com.chartbot.automation.ScheduleService;
import com.chartbot.automation.SchedulerLoop;
import com.chartbot.automation.SchedulerSettings;
import com.chartbot.automation.Timebox;
import com.chartbot.config.Config;
import com.chartbot.data.calendar.EconomicEventFeed;
import com.chartbot.data.calendar.FmpEconomicCalendarClient;
import com.chartbot.data.capture.ChartCaptureClient;
import com.chartbot.data.capture.ChartImgCaptureClient;
import com.chartbot.data.http.HttpClientEx;
import com.chartbot.db.AccountDao;
import com.chartbot.db.Database;
import com.chartbot.db.EconomicContextDao;
import com.chartbot.db.JobLogDao;
import com.chartbot.db.MigrationRunner;
import com.chartbot.db.ScheduleDao;
import com.chartbot.db.SignalDao;
import com.chartbot.notify.TelegramAlertRenderer;
import com.chartbot.notify.TelegramBotClient;
import com.chartbot.notify.TelegramTransport;
import com.chartbot.security.CredentialCipher;
import com.chartbot.store.AccountRepository;
import com.chartbot.store.EconomicContextRepository;
import com.chartbot.store.JobLogRepository;
import com.chartbot.store.ScheduleRepository;
import com.chartbot.store.SignalRepository;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@EnableConfigurationProperties({
        DbProperties.class,
        SchedulerProperties.class,
        TelegramProperties.class,
        CryptoProperties.class
})
public class ChartBotBootstrapConfig {
    @Bean
    public Config chartBotConfig(Environment environment) {
        Map<String, Object> rawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        return Config.fromConfigurationProperties(rawProperties);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SchedulerSettings schedulerSettings(SchedulerProperties schedulerProperties) {
        return schedulerProperties.toSettings();
    }

    @Bean
    @Lazy
    public Database database(DbProperties dbProperties) {
        Database database = new Database(
                readDbUrl(dbProperties),
                readDbUser(dbProperties),
                readDbPass(dbProperties),
                readDbSchema(dbProperties),
                dbProperties == null ? 30 : dbProperties.getStatementTimeoutSeconds(),
                isSqlLogEnabled(dbProperties)
        );
        try {
            new MigrationRunner().run(database);
        } catch (Exception e) {
            throw new IllegalStateException("Database migration failed: " + e.getMessage(), e);
        }
        return database;
    }

    @Bean
    @Lazy
    public ScheduleRepository scheduleRepository(Database database) {
        return new ScheduleDao(database);
    }

    @Bean
    @Lazy
    public JobLogRepository jobLogRepository(Database database) {
        return new JobLogDao(database);
    }

    @Bean
    @Lazy
    public SignalRepository signalRepository(Database database) {
        return new SignalDao(database);
    }

    @Bean
    @Lazy
    public EconomicContextRepository economicContextRepository(Database database) {
        return new EconomicContextDao(database);
    }

    @Bean
    @Lazy
    public AccountRepository accountRepository(Database database) {
        return new AccountDao(database);
    }

    @Bean
    public CredentialCipher credentialCipher(CryptoProperties cryptoProperties) {
        return CredentialCipher.fromHexKey(firstNonBlank(
                System.getenv("CHARTBOT_ENCRYPTION_KEY"),
                cryptoProperties == null ? null : cryptoProperties.getEncryptionKey()
        ));
    }

    @Bean
    public HttpClientEx httpClient() {
        return new HttpClientEx();
    }

    @Bean
    @Lazy
    public ChatModelRegistry chatModelRegistry(Config config) {
        return new ChatModelRegistry(config);
    }

    @Bean
    @Lazy
    public ChartCaptureClient chartCaptureClient(Config config, HttpClientEx http, SchedulerSettings settings) {
        return new ChartImgCaptureClient(config, http, (int) settings.captureTimeout.toSeconds());
    }

    @Bean
    @Lazy
    public ChartAnalyzer chartAnalyzer(ChatModelRegistry registry) {
        return new LangChainChartAnalyzer(registry);
    }

    @Bean
    @Lazy
    public EconomicEventFeed economicEventFeed(Config config, HttpClientEx http, Clock clock) {
        return new FmpEconomicCalendarClient(config, http, clock);
    }

    @Bean
    @Lazy
    public ImpactSummarizer impactSummarizer(Config config, ChatModelRegistry registry) {
        return new LangChainImpactSummarizer(registry, config.getString("economic.summarizer-model", ""));
    }

    @Bean
    @Lazy
    public TelegramTransport telegramTransport(HttpClientEx http, TelegramProperties telegramProperties) {
        return new TelegramBotClient(
                http,
                telegramProperties.getApiBaseUrl(),
                firstNonBlank(System.getenv("CHARTBOT_TELEGRAM_BOT_TOKEN"), telegramProperties.getBotToken()),
                telegramProperties.getRequestTimeoutSeconds()
        );
    }

    @Bean
    public TelegramAlertRenderer telegramAlertRenderer(Config config) {
        return new TelegramAlertRenderer(config.getString("app.url", "http://localhost:3000"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stageExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "chartbot-stage-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    @Lazy
    public AutomationPipeline automationPipeline(
            AccountRepository accounts,
            CredentialCipher cipher,
            ChatModelRegistry registry,
            ChartCaptureClient captureClient,
            ChartAnalyzer analyzer,
            SignalRepository signals,
            EconomicEventFeed feed,
            ImpactSummarizer summarizer,
            EconomicContextRepository contexts,
            TelegramTransport transport,
            TelegramAlertRenderer renderer,
            TelegramProperties telegramProperties,
            SchedulerSettings settings,
            ExecutorService stageExecutor,
            Clock clock
    ) {
        Timebox timebox = new Timebox(stageExecutor);
        return new AutomationPipeline(
                new JobBuilder(accounts, cipher, registry),
                new CaptureStage(captureClient, timebox, settings.captureConcurrency, settings.captureTimeout, clock),
                new AnalysisStage(analyzer, signals, timebox, settings.analysisTimeout, clock),
                new EnrichmentStage(feed, summarizer, contexts, timebox, settings.enrichmentTimeout, clock),
                new NotificationGate(),
                new DispatchStage(transport, renderer, telegramProperties.isErrorAlerts()),
                clock
        );
    }

    @Bean(destroyMethod = "close")
    @Lazy
    public SchedulerLoop schedulerLoop(
            ScheduleRepository schedules,
            JobLogRepository jobLogs,
            AutomationPipeline pipeline,
            SchedulerSettings settings,
            Clock clock
    ) {
        return new SchedulerLoop(
                new DueSelector(schedules),
                schedules,
                pipeline,
                new JobLogRecorder(schedules, jobLogs, clock),
                new ScheduleGuard(),
                settings,
                clock
        );
    }

    @Bean
    @Lazy
    public ScheduleService scheduleService(
            ScheduleRepository schedules,
            AccountRepository accounts,
            JobLogRepository jobLogs,
            SchedulerLoop loop,
            Clock clock
    ) {
        return new ScheduleService(schedules, accounts, jobLogs, loop, clock);
    }

    private String readDbUrl(DbProperties dbProperties) {
        return firstNonBlank(
                System.getenv("CHARTBOT_DB_URL"),
                dbProperties == null ? null : dbProperties.getUrl(),
                "jdbc:postgresql://localhost:5432/chartbot"
        );
    }

    private String readDbUser(DbProperties dbProperties) {
        return firstNonBlank(
                System.getenv("CHARTBOT_DB_USER"),
                dbProperties == null ? null : dbProperties.getUser(),
                "chartbot"
        );
    }

    private String readDbPass(DbProperties dbProperties) {
        return firstNonBlank(
                System.getenv("CHARTBOT_DB_PASS"),
                dbProperties == null ? null : dbProperties.getPass(),
                "chartbot"
        );
    }

    private String readDbSchema(DbProperties dbProperties) {
        return firstNonBlank(
                dbProperties == null ? null : dbProperties.getSchema(),
                "chartbot"
        );
    }

    private boolean isSqlLogEnabled(DbProperties dbProperties) {
        if (dbProperties == null || dbProperties.getSqlLog() == null) {
            return false;
        }
        return dbProperties.getSqlLog().isEnabled();
    }

    private static String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
