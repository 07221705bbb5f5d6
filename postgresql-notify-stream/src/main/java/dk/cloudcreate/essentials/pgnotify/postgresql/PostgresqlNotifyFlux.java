package dk.cloudcreate.essentials.pgnotify.postgresql;

import dk.cloudcreate.essentials.pgnotify.postgresql.connection.*;
import dk.cloudcreate.essentials.pgnotify.postgresql.poll.NotificationPollLoop;
import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import org.jdbi.v3.core.Jdbi;
import org.slf4j.*;
import reactor.core.Exceptions;
import reactor.core.publisher.*;
import reactor.util.retry.Retry;

import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Turns PostgreSQL <code>LISTEN</code>/<code>NOTIFY</code> into a shared {@link Flux} of {@link NotificationEvent}'s.<br>
 * <br>
 * The returned {@link Flux} is cold until the first subscription: the first subscriber opens a dedicated connection,
 * executes <code>LISTEN</code> for every channel and starts polling the connection every {@link NotificationStreamConfig#pollingInterval}
 * on a dedicated thread. Additional subscribers share the same connection and poll loop. When the last subscriber cancels, the poll loop is stopped
 * and the connection closed; a later subscriber will open a new connection and only receive notifications sent after that.<br>
 * <br>
 * If opening the connection, registering the channels or polling fails, the failure is logged and the stream reconnects after
 * {@link NotificationStreamConfig#reconnectionTimeout}. Reconnection is attempted indefinitely with a fixed delay and subscribers
 * don't see these failures.<br>
 * <br>
 * <b>CAUTION: every call to one of the <code>forChannels</code> methods defines a new stream, which will use its own connection once subscribed.</b>
 * Use a single stream for as many channels as possible and filter (e.g. using {@link #onlyChannels(Flux, CharSequence...)}) on the subscriber side.
 * <pre>{@code
 * var notifications = PostgresqlNotifyFlux.forChannels(jdbcUrl, user, password, List.of("orders", "customers"));
 * notifications.filter(event -> event.isFor("orders"))
 *              .subscribe(event -> log.info("Order notification {}", event.payload));
 * }</pre>
 */
public final class PostgresqlNotifyFlux {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlNotifyFlux.class);

    private PostgresqlNotifyFlux() {
    }

    /**
     * Create a notification stream using {@link NotificationStreamConfig#defaults()}
     *
     * @param jdbcUrl  The JDBC url to use to connect to Postgresql
     * @param user     The user name to use to connect to Postgresql
     * @param password The password to use to connect to Postgresql
     * @param channels The channels to <code>LISTEN</code> to
     * @return the shared notification stream
     * @throws IllegalArgumentException if no channels are provided or any channel name is blank
     */
    public static Flux<NotificationEvent> forChannels(String jdbcUrl,
                                                      String user,
                                                      String password,
                                                      List<String> channels) {
        return forChannels(jdbcUrl,
                           user,
                           password,
                           NotificationStreamConfig.DEFAULT_POLLING_INTERVAL.toMillis(),
                           NotificationStreamConfig.DEFAULT_RECONNECTION_TIMEOUT.toMillis(),
                           channels,
                           NotificationStreamConfig.DEFAULT_BACKPRESSURE_STRATEGY);
    }

    /**
     * @param jdbcUrl               The JDBC url to use to connect to Postgresql
     * @param user                  The user name to use to connect to Postgresql
     * @param password              The password to use to connect to Postgresql
     * @param pollingPeriodMs       Number of milliseconds to wait between two polls for new notifications
     * @param reconnectionTimeoutMs Number of milliseconds to wait after a failure before reconnecting
     * @param channels              The channels to <code>LISTEN</code> to
     * @param backpressureStrategy  What to do when subscribers can't keep up
     * @return the shared notification stream
     * @throws IllegalArgumentException if no channels are provided, any channel name is blank or a period isn't positive
     */
    public static Flux<NotificationEvent> forChannels(String jdbcUrl,
                                                      String user,
                                                      String password,
                                                      long pollingPeriodMs,
                                                      long reconnectionTimeoutMs,
                                                      List<String> channels,
                                                      BackpressureStrategy backpressureStrategy) {
        var channelNames = ChannelName.ofAll(channels);
        var config       = NotificationStreamConfig.of(pollingPeriodMs, reconnectionTimeoutMs, backpressureStrategy);
        return forChannels(JdbiNotificationConnectionFactory.create(jdbcUrl, user, password),
                           config,
                           channelNames);
    }

    public static Flux<NotificationEvent> forChannels(Jdbi jdbi,
                                                      NotificationStreamConfig config,
                                                      List<ChannelName> channels) {
        return forChannels(new JdbiNotificationConnectionFactory(jdbi),
                           config,
                           channels);
    }

    /**
     * Define a notification stream. Defining the stream has no side effects, the connection is first opened when the stream is subscribed to
     *
     * @param connectionFactory the factory used to open a new connection for every activation of the stream
     * @param config            the stream configuration
     * @param channels          the channels to <code>LISTEN</code> to, in the order they're registered
     * @return the shared notification stream
     */
    public static Flux<NotificationEvent> forChannels(NotificationConnectionFactory connectionFactory,
                                                      NotificationStreamConfig config,
                                                      List<ChannelName> channels) {
        requireNonNull(connectionFactory, "You must supply a connectionFactory");
        requireNonNull(config, "You must supply a config");
        requireNonNull(channels, "You must supply channels");
        requireTrue(!channels.isEmpty(), "You must specify at least one channel");
        channels.forEach(channel -> requireNonNull(channel, "Channel name cannot be null"));

        var channelSet        = List.copyOf(channels);
        var streamName        = "PostgresqlNotify:" + channelSet.stream().map(ChannelName::toString).collect(Collectors.joining(","));
        var connectionManager = new NotificationConnectionManager(connectionFactory);

        var activation = Flux.<NotificationEvent>create(sink -> activate(streamName, connectionManager, channelSet, config, sink),
                                                        config.backpressureStrategy.overflowStrategy());

        return activation
                .onErrorMap(Exceptions::isOverflow,
                            e -> new NotificationStreamOverflowException(msg("[{}] Subscribers couldn't keep up with the notifications received", streamName), e))
                .doOnError(throwable -> {
                    if (isRetryable(throwable)) {
                        log.error(msg("[{}] Exception while retrieving notifications from the database. Will reconnect in {}ms",
                                      streamName,
                                      config.reconnectionTimeout.toMillis()),
                                  throwable);
                    } else {
                        log.error(msg("[{}] Notification stream terminated without reconnecting", streamName), throwable);
                    }
                })
                .retryWhen(Retry.fixedDelay(Long.MAX_VALUE, config.reconnectionTimeout)
                                .filter(PostgresqlNotifyFlux::isRetryable)
                                .doBeforeRetry(retrySignal -> log.debug("[{}] Reconnecting after {} failure(s)",
                                                                        streamName,
                                                                        retrySignal.totalRetries() + 1)))
                .share();
    }

    /**
     * Only let notifications for the given channels through
     *
     * @param notifications the notification stream
     * @param channels      the channels to keep
     * @return the filtered stream
     */
    public static Flux<NotificationEvent> onlyChannels(Flux<NotificationEvent> notifications, CharSequence... channels) {
        requireNonNull(notifications, "No notifications stream provided");
        requireNonNull(channels, "No channels provided");
        var channelNames = Arrays.stream(channels)
                                 .map(ChannelName::of)
                                 .collect(Collectors.toSet());
        return notifications.filter(event -> channelNames.contains(event.channel));
    }

    private static boolean isRetryable(Throwable throwable) {
        return !(throwable instanceof NotificationStreamOverflowException);
    }

    /**
     * Starts a new {@link NotificationPollLoop} on its own thread. Disposing the sink (cancellation or termination)
     * cancels the loop and interrupts its thread
     */
    private static void activate(String streamName,
                                 NotificationConnectionManager connectionManager,
                                 List<ChannelName> channels,
                                 NotificationStreamConfig config,
                                 FluxSink<NotificationEvent> sink) {
        log.debug("[{}] Activating notification stream", streamName);
        var pollLoop = new NotificationPollLoop(streamName,
                                                connectionManager,
                                                channels,
                                                config.pollingInterval,
                                                sink);
        var worker = Executors.newSingleThreadExecutor(ThreadFactoryBuilder.builder()
                                                                           .nameFormat(streamName.replace("%", "%%") + "-Polling-%d")
                                                                           .daemon(true)
                                                                           .build());
        Future<?> pollingTask = worker.submit(pollLoop);
        worker.shutdown();
        sink.onDispose(() -> {
            log.debug("[{}] Deactivating notification stream", streamName);
            pollLoop.cancel();
            pollingTask.cancel(true);
        });
    }
}
