package com.sitemonitor.service;

import com.sitemonitor.core.bus.EventBus;
import com.sitemonitor.service.config.ConfigLoader;
import com.sitemonitor.service.config.MonitorConfig;
import com.sitemonitor.service.config.TransportConfig;
import com.sitemonitor.service.http.HttpClientFactory;
import com.sitemonitor.service.notify.LoggingMessageTransport;
import com.sitemonitor.service.notify.MessageTransport;
import com.sitemonitor.service.notify.NotificationDispatcher;
import com.sitemonitor.service.notify.OneBotHttpTransport;
import com.sitemonitor.service.runtime.PollCycle;
import com.sitemonitor.service.runtime.SiteLoader;
import com.sitemonitor.service.runtime.SiteScheduler;
import com.sitemonitor.service.store.JsonFileSnapshotStore;
import com.sitemonitor.service.store.EventStore;
import com.sitemonitor.service.store.JsonlEventStore;
import com.sitemonitor.service.subscription.SubscriptionRegistry;
import com.sitemonitor.sites.api.SiteAdapter;
import com.sitemonitor.sites.api.SiteContext;
import com.sitemonitor.sites.example.ExampleCounterSite;
import com.sitemonitor.sites.web.WebPageSite;
import com.sitemonitor.sites.web.WebPageSiteConfig;
import com.sitemonitor.sites.web.WebPageSitesConfig;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        installLogging();
        Path configDir = ConfigLoader.resolveConfigDir(System.getenv());
        MonitorConfig config = ConfigLoader.loadMonitor(configDir);
        WebPageSitesConfig webSites = ConfigLoader.loadSites(configDir);
        Path dataDir = Path.of(config.dataDir());
        Clock clock = Clock.systemDefaultZone();

        EventBus eventBus = new EventBus((event, error) ->
                LOGGER.log(Level.WARNING, "Event handler failed for " + event.type(), error));
        EventStore eventStore = new JsonlEventStore(Path.of(config.journalFile()));
        eventBus.subscribeAll(eventStore::append);

        JsonFileSnapshotStore snapshotStore = new JsonFileSnapshotStore(Path.of(config.cacheDir()));
        SubscriptionRegistry registry = new SubscriptionRegistry(
                dataDir.resolve(SubscriptionRegistry.DEFAULT_FILE_NAME),
                config.allToken()
        );

        HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(5));
        MessageTransport transport = transportFor(config.transport(), httpClient, config.requestTimeout());
        NotificationDispatcher dispatcher = new NotificationDispatcher(transport, eventBus, clock);

        SiteContext context = new SiteContext(httpClient, clock, config.requestTimeout(), snapshotStore::load);
        PollCycle pollCycle = new PollCycle(snapshotStore, registry, dispatcher, eventBus, context);
        SiteScheduler scheduler = new SiteScheduler(pollCycle, clock, config.workerThreads());

        List<String> loaded = new SiteLoader(scheduler, config.allToken()).load(adaptersFor(config, webSites));
        LOGGER.info("Monitoring " + loaded.size() + " site(s): " + loaded);
        scheduler.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            LOGGER.info("Site monitor stopped");
            shutdownLatch.countDown();
        }));
        shutdownLatch.await();
    }

    static List<SiteAdapter> adaptersFor(MonitorConfig config, WebPageSitesConfig webSites) {
        List<SiteAdapter> adapters = new ArrayList<>();
        if (config.exampleSiteEnabled()) {
            adapters.add(new ExampleCounterSite());
        }
        for (WebPageSiteConfig site : webSites.sitesOrEmpty()) {
            adapters.add(new WebPageSite(site));
        }
        return adapters;
    }

    static MessageTransport transportFor(TransportConfig transport, HttpClient httpClient, Duration requestTimeout) {
        if (TransportConfig.ONEBOT.equals(transport.type())) {
            return new OneBotHttpTransport(httpClient, URI.create(transport.baseUrl()), transport.accessToken(), requestTimeout);
        }
        return new LoggingMessageTransport(new HashSet<>(transport.knownGroups()));
    }

    private static void installLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed reading logging.properties", e);
        }
    }
}
