package ru.hedge;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableAsync;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;
import ru.hedge.config.HedgeConfig;
import ru.hedge.service.SafetyMonitor;
import ru.hedge.service.TelegramChatService;

import java.time.Duration;
import java.util.Arrays;

@Slf4j
@EnableAsync
@SpringBootApplication
@EnableConfigurationProperties
public class HedgeApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(HedgeApplication.class);
        //Own hook below: the running cycle must finish before the context goes away
        app.setRegisterShutdownHook(false);
        ConfigurableApplicationContext context = app.run(args);

        context.getBeanProvider(TelegramChatService.class).ifAvailable(HedgeApplication::registerBot);

        TradingRunner runner = context.getBean(TradingRunner.class);
        SafetyMonitor safetyMonitor = context.getBean(SafetyMonitor.class);
        long shutdownWaitMs = context.getBean(HedgeConfig.class).getSafety().getShutdownWaitMs();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (!runner.isFinished()) {
                safetyMonitor.handleInterrupt();
                if (!runner.awaitCompletion(Duration.ofMillis(shutdownWaitMs))) {
                    log.warn("[HedgeBot] Cycle did not finish within {} ms", shutdownWaitMs);
                }
            }
            context.close();
        }, "hedge-shutdown"));

        boolean singleCycle = Arrays.asList(args).contains("--single-cycle");
        int exitCode = runner.run(singleCycle);
        log.info("[HedgeBot] Finished with exit code {}", exitCode);
        System.exit(exitCode);
    }

    private static void registerBot(TelegramChatService telegramService) {
        try {
            TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
            botsApi.registerBot(telegramService);
            log.info("Telegram bot registered successfully!");
        } catch (TelegramApiException e) {
            log.error("Failed to register Telegram bot: " + e.getMessage());
        }
    }
}
