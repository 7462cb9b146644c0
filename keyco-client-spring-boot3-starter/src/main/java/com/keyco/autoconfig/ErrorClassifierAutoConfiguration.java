package com.keyco.autoconfig;

import com.keyco.core.failure.OutcomeHandlerFactory;
import com.keyco.core.failure.RouterErrorClassifier;
import com.keyco.core.failure.decider.*;
import com.keyco.core.failure.handler.CancelledOutcomeHandler;
import com.keyco.core.failure.handler.RetryOutcomeHandler;
import com.keyco.core.failure.handler.TerminalOutcomeHandler;
import com.keyco.core.spi.failure.ErrorClassifier;
import com.keyco.core.spi.failure.FailureCaseHandler;
import com.keyco.core.spi.failure.OutcomeHandler;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import java.util.List;

@AutoConfiguration
@ConditionalOnProperty(prefix = "keyco.client", name = "enabled", matchIfMissing = true)
public class ErrorClassifierAutoConfiguration {

    // 默认内置一组分类器（用户可通过 Bean 覆盖/新增）
    @Bean
    @ConditionalOnMissingBean(CancelledCallHandler.class)
    public CancelledCallHandler cancelledCallHandler() { return new CancelledCallHandler(); }

    @Bean
    @ConditionalOnMissingBean(TimeoutHandler.class)
    public TimeoutHandler timeoutHandler() { return new TimeoutHandler(); }

    @Bean
    @ConditionalOnMissingBean(HttpStatusHandler.class)
    public HttpStatusHandler httpStatusHandler() { return new HttpStatusHandler(); }

    @Bean
    @ConditionalOnMissingBean(InvalidResponseHandler.class)
    public InvalidResponseHandler invalidResponseHandler() { return new InvalidResponseHandler(); }

    @Bean
    @ConditionalOnMissingBean(IoFailureHandler.class)
    public IoFailureHandler ioFailureHandler() { return new IoFailureHandler(); }

    @Bean
    @ConditionalOnMissingBean(ApiExceptionHandler.class)
    public ApiExceptionHandler apiExceptionHandler() { return new ApiExceptionHandler(); }

    @Bean
    @ConditionalOnMissingBean(UnknownHandler.class)
    public UnknownHandler unknownHandler() { return new UnknownHandler(); }

    // Router 分类器, 注入全部 FailureCaseHandler
    @Bean
    @ConditionalOnMissingBean(ErrorClassifier.class)
    public ErrorClassifier errorClassifier(List<FailureCaseHandler<?>> handlers) {
        return new RouterErrorClassifier(handlers);
    }

    @Bean
    @ConditionalOnMissingBean(RetryOutcomeHandler.class)
    public RetryOutcomeHandler retryOutcomeHandler() { return new RetryOutcomeHandler(); }

    @Bean
    @ConditionalOnMissingBean(TerminalOutcomeHandler.class)
    public TerminalOutcomeHandler terminalOutcomeHandler() { return new TerminalOutcomeHandler(); }

    @Bean
    @ConditionalOnMissingBean(CancelledOutcomeHandler.class)
    public CancelledOutcomeHandler cancelledOutcomeHandler() { return new CancelledOutcomeHandler(); }

    @Bean
    @ConditionalOnMissingBean(OutcomeHandlerFactory.class)
    public OutcomeHandlerFactory outcomeHandlerFactory(List<OutcomeHandler> handlers) {
        return new OutcomeHandlerFactory(handlers);
    }
}
