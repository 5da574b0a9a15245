package dao.solana.svol.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.solana.svol.chain.ChainGateway;
import dao.solana.svol.chain.SimulatedChainGateway;
import dao.solana.svol.chain.SolanaRpcChainGateway;
import dao.solana.svol.chain.SolanaTransactionFactory;
import dao.solana.svol.chain.TransactionFactory;
import dao.solana.svol.event.EventBus;
import dao.solana.svol.event.ProgressSink;
import dao.solana.svol.service.ApprovalCallback;
import dao.solana.svol.service.FeeOracle;
import dao.solana.svol.service.ScheduleExecutor;
import dao.solana.svol.service.TransactionExecutor;
import dao.solana.svol.wallet.WalletKeyProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the chain backend and the execution pipeline. chain.mode picks the gateway.
 */
@Slf4j
@Configuration
public class ExecutionConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate solanaRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public ChainGateway chainGateway(ChainProperties chainProps, RestTemplate solanaRestTemplate, ObjectMapper objectMapper) {
        log.info("Chain mode: {}", chainProps.getMode());
        if (chainProps.getMode() == ChainProperties.Mode.RPC) {
            return new SolanaRpcChainGateway(solanaRestTemplate, objectMapper, chainProps);
        }
        return new SimulatedChainGateway(chainProps.getSimulatedBaseFee());
    }

    @Bean
    public TransactionFactory transactionFactory(ChainGateway chainGateway, ChainProperties chainProps) {
        return new SolanaTransactionFactory(chainGateway, chainProps.getNativeMint());
    }

    @Bean
    public FeeOracle feeOracle(ChainGateway chainGateway, FeeProperties feeProps, Clock clock) {
        return new FeeOracle(chainGateway, feeProps.getOracle(), clock);
    }

    @Bean
    public TransactionExecutor transactionExecutor(ChainGateway chainGateway,
                                                   TransactionFactory transactionFactory,
                                                   FeeOracle feeOracle,
                                                   EventBus eventBus,
                                                   ApprovalCallback approvalCallback,
                                                   SchedulerProperties schedulerProps,
                                                   Clock clock) {
        return new TransactionExecutor(chainGateway, transactionFactory, feeOracle, eventBus,
                approvalCallback, schedulerProps.getExecution(), clock);
    }

    @Bean
    public ScheduleExecutor scheduleExecutor(TransactionExecutor transactionExecutor,
                                             WalletKeyProvider walletKeyProvider,
                                             ProgressSink progressSink,
                                             Clock clock) {
        return new ScheduleExecutor(transactionExecutor, walletKeyProvider, progressSink, clock);
    }
}
