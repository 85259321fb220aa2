package com.backtester.config;

import com.backtester.execution.ExecutionHandler;
import com.backtester.execution.SimulatedExecutionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the default {@link ExecutionHandler} bean from {@code backtester.commission.*} and
 * {@code backtester.slippage-bps}.
 */
@Configuration
public class ExecutionConfig {

    @Bean
    public ExecutionHandler executionHandler(BacktestProperties backtestProperties) {
        BacktestProperties.Commission commission = backtestProperties.getCommission();
        return SimulatedExecutionHandler.builder()
                .commissionPerShare(commission.getPerShare())
                .commissionPercentage(commission.getPercentage())
                .minimumCommission(commission.getMinimum())
                .slippageBps(backtestProperties.getSlippageBps())
                .build();
    }
}
