package relay.spring.boot;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import relay.MessageSender;
import relay.Relay;
import relay.dispatch.ExponentialBackoffRetryPolicy;
import relay.jdbc.DataSourceConnectionProvider;
import relay.jdbc.store.JdbcMembershipChecker;
import relay.jdbc.store.JdbcMessageStore;
import relay.jdbc.store.JdbcOutboxStore;
import relay.spi.ConnectionProvider;
import relay.spi.CredentialVerifier;
import relay.spi.MembershipChecker;
import relay.spi.MessageStore;
import relay.spi.MetricsExporter;
import relay.spi.OutboxStore;
import relay.spi.TxContext;
import relay.spring.SpringTxContext;

import javax.sql.DataSource;

/**
 * Auto-configuration for the realtime relay.
 *
 * <p>Wires a {@link Relay} composite from a {@link DataSource} and {@link RelayProperties}.
 * Every collaborator backs off when the application defines its own bean of that type.
 * A {@link CredentialVerifier} must either be supplied or come from {@code relay.jwt.secret}.
 *
 * @see RelayProperties
 * @see RelayMicrometerAutoConfiguration
 * @see RelayWebSocketAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Relay.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(RelayProperties.class)
public class RelayAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(OutboxStore.class)
  public JdbcOutboxStore outboxStore(RelayProperties props) {
    return new JdbcOutboxStore(props.getTableName());
  }

  @Bean
  @ConditionalOnMissingBean(MessageStore.class)
  public JdbcMessageStore messageStore() {
    return new JdbcMessageStore();
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TxContext.class)
  public SpringTxContext txContext(DataSource dataSource) {
    return new SpringTxContext(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(MembershipChecker.class)
  public JdbcMembershipChecker membershipChecker(ConnectionProvider connectionProvider) {
    return new JdbcMembershipChecker(connectionProvider);
  }

  @Bean
  @ConditionalOnMissingBean(CredentialVerifier.class)
  @ConditionalOnProperty(prefix = "relay.jwt", name = "secret")
  public JwtCredentialVerifier credentialVerifier(RelayProperties props) {
    return new JwtCredentialVerifier(props.getJwt().getSecret());
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Relay relay(RelayProperties props,
                     ConnectionProvider connectionProvider,
                     TxContext txContext,
                     OutboxStore outboxStore,
                     MessageStore messageStore,
                     MembershipChecker membershipChecker,
                     ObjectProvider<CredentialVerifier> credentialVerifierProvider,
                     ObjectProvider<MetricsExporter> metricsProvider) {

    CredentialVerifier credentialVerifier = credentialVerifierProvider.getIfAvailable();
    if (credentialVerifier == null) {
      throw new IllegalStateException(
          "No CredentialVerifier available: set relay.jwt.secret or define a CredentialVerifier bean");
    }
    RelayProperties.Websocket ws = props.getWebsocket();
    var builder = Relay.builder()
        .connectionProvider(connectionProvider)
        .txContext(txContext)
        .outboxStore(outboxStore)
        .messageStore(messageStore)
        .credentialVerifier(credentialVerifier)
        .membershipChecker(membershipChecker)
        .retryPolicy(new ExponentialBackoffRetryPolicy(
            props.getRetry().getBaseDelayMs(), props.getRetry().getMaxDelayMs()))
        .batchSize(props.getDispatcher().getBatchSize())
        .intervalMs(props.getDispatcher().getIntervalMs())
        .autoStart(props.getDispatcher().isEnabled())
        .maxContentLength(props.getMessage().getMaxContentLength())
        .maxSubscriptionsPerConnection(ws.getMaxSubscriptions())
        .maxFrameBytes(ws.getMaxFrameBytes())
        .maxIdsPerSubscribe(ws.getMaxIdsPerSubscribe())
        .rateLimit(ws.getRateLimitCommands(), ws.getRateLimitWindow())
        .idleTimeout(ws.getIdleTimeout())
        .heartbeatInterval(ws.getHeartbeatInterval())
        .handshakeTimeout(ws.getHandshakeTimeout());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public MessageSender messageSender(Relay relay) {
    return relay.sender();
  }
}
