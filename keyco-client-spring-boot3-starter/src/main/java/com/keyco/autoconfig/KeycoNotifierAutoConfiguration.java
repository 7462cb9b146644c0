package com.keyco.autoconfig;

import com.keyco.config.KeycoNotifierProperties;
import com.keyco.core.metric.ClientMetrics;
import com.keyco.core.notify.AsyncNotifyingService;
import com.keyco.core.notify.NotifyingFacade;
import com.keyco.core.notify.notifier.LoggingNotifier;
import com.keyco.core.notify.ratelimit.RateLimitFilter;
import com.keyco.core.notify.route.SimpleRouter;
import com.keyco.core.spi.notify.Notifier;
import com.keyco.core.spi.notify.NotifierRouter;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@AutoConfiguration(after = KeycoClientMetricsAutoConfiguration.class)
@ConditionalOnProperty(prefix = "keyco.client", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(KeycoNotifierProperties.class)
public class KeycoNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotifier")
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }

    @Bean
    @ConditionalOnMissingBean(NotifierRouter.class)
    public NotifierRouter notifierRouter(List<Notifier> notifiers) {
        return new SimpleRouter(notifiers);
    }

    @Bean
    @ConditionalOnProperty(prefix = "keyco.client.notify", name = "enabled")
    public AsyncNotifyingService asyncNotifyingService(NotifierRouter router,
                                                       ClientMetrics metrics,
                                                       KeycoNotifierProperties props) {
        KeycoNotifierProperties.Async cfg = props.getAsync();
        ThreadPoolExecutor exec = new ThreadPoolExecutor(cfg.getCorePoolSize(),
                cfg.getMaxPoolSize(),
                cfg.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                r -> {
                    Thread t = new Thread(r, "keyco-notify");
                    t.setDaemon(true);
                    t.setUncaughtExceptionHandler((th, e) -> LoggerFactory.getLogger("notify").error("uncaught", e));
                    return t;
                },
                new ThreadPoolExecutor.CallerRunsPolicy());
        RateLimitFilter filter = new RateLimitFilter(props.getRateLimit().getWindow(), props.getRateLimit().getThreshold());
        return new AsyncNotifyingService(exec, router, filter, metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotifyingFacade notifyingFacade(ObjectProvider<AsyncNotifyingService> provider) {
        return new NotifyingFacade(provider);
    }
}
