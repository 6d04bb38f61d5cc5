package com.lux032.yearresolver;

import com.lux032.yearresolver.config.YearResolverConfig;
import com.lux032.yearresolver.core.ApplicationLifecycleManager;
import com.lux032.yearresolver.model.ResolutionSummary;
import com.lux032.yearresolver.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

/**
 * Album year resolver: resolves release years for every album of the library snapshot,
 * applies them and reports the albums still waiting for verification.
 */
@Slf4j
public class Main {

    public static void main(String[] args) {
        YearResolverConfig config = YearResolverConfig.getInstance();
        I18nUtil.init(config.getLanguage());

        if (!config.isValid()) {
            log.error(I18nUtil.getMessage("app.config.invalid"));
            System.exit(1);
        }

        ApplicationLifecycleManager lifecycleManager = new ApplicationLifecycleManager(config);
        Runtime.getRuntime().addShutdownHook(new Thread(lifecycleManager::shutdown, "year-resolver-shutdown"));

        int exitCode = 0;
        try {
            lifecycleManager.initializeServices();
            ResolutionSummary summary = config.isRecheckOnly()
                ? lifecycleManager.runRecheckPass()
                : lifecycleManager.runResolutionPass();
            int problematic = lifecycleManager.writeProblematicAlbumsReport();
            log.info(I18nUtil.getMessage("main.finished"), summary.getAlbumsProcessed(),
                summary.getTracksUpdated(), problematic);
        } catch (Exception e) {
            log.error(I18nUtil.getMessage("main.error"), e);
            exitCode = 1;
        } finally {
            lifecycleManager.shutdown();
        }

        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }
}
