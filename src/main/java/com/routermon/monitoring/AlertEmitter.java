package com.routermon.monitoring;

import com.routermon.core.EngineConfig;

import com.routermon.models.AlertCandidate;

import com.routermon.models.AlertType;

import com.routermon.services.AlertService;

import com.routermon.services.NotificationDispatcher;

import io.vertx.core.Future;

import io.vertx.core.Promise;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import java.time.Clock;

import java.util.Map;

import java.util.concurrent.ConcurrentHashMap;

/**
 * AlertEmitter - Deduplicated alert persistence and notification

 * Flow for emit():
 * 1. Drop the candidate when alerts are disabled globally or for its category
 * 2. Wait for any earlier emit with the same (device, target, type) to finish
 * 3. shouldEmit(): look up the newest alert with the same (device, target, type)
 *    inside the dedup window; emit when there is none or its state differs
 * 4. Persist the alert row
 * 5. Hand the notification payload to the dispatcher (failures logged, never returned)

 * A persistence failure fails the returned future; callers decide whether that
 * is fatal for their feature.
 */
public class AlertEmitter
{

    private static final Logger logger = LoggerFactory.getLogger(AlertEmitter.class);

    private final AlertService alertService;

    private final NotificationDispatcher dispatcher;

    private final EngineConfig config;

    private final Clock clock;

    // newest pending emit per dedup key
    private final Map<String, Future<Boolean>> inProgress = new ConcurrentHashMap<>();

    public AlertEmitter(AlertService alertService, NotificationDispatcher dispatcher, EngineConfig config, Clock clock)
    {
        this.alertService = alertService;

        this.dispatcher = dispatcher;

        this.config = config;

        this.clock = clock;
    }

    /**
     * Decide whether an alert for (device, target, type) in newState should be emitted now.
     *
     * @param deviceId device the alert belongs to
     * @param target dedup target (watched host, device address, session key)
     * @param type alert category
     * @param newState settled state being reported
     * @return Future with true when no alert in the window carries the same state
     */
    public Future<Boolean> shouldEmit(String deviceId, String target, AlertType type, String newState)
    {
        var promise = Promise.<Boolean>promise();

        try
        {
            var since = clock.instant().minus(config.getDedupWindow());

            alertService.alertFindLatest(deviceId, target, type.value(), since)
                .onSuccess(latest ->
                {
                    if (!latest.getBoolean("found", false))
                    {
                        promise.complete(true);

                        return;
                    }

                    var previousState = latest.getString("state");

                    promise.complete(previousState == null || !previousState.equals(newState));
                })
                .onFailure(promise::fail);
        }
        catch (Exception exception)
        {
            logger.error("Error in shouldEmit: {}", exception.getMessage());

            promise.fail(exception);
        }

        return promise.future();
    }

    /**
     * Persist and dispatch the candidate unless it is disabled or deduplicated.
     * Emits sharing a (device, target, type) key run one after another, so a second
     * emit always sees the row the first one persisted.
     *
     * @param candidate alert to raise
     * @return Future with true when the alert was persisted
     */
    public Future<Boolean> emit(AlertCandidate candidate)
    {
        try
        {
            if (!config.isAlertsEnabled() || !config.isAlertCategoryEnabled(candidate.type))
            {
                logger.debug("Alerts of type {} disabled, dropping alert for {}", candidate.type.value(), candidate.target);

                return Future.succeededFuture(false);
            }

            var key = candidate.deviceId + "|" + candidate.target + "|" + candidate.type.value();

            var promise = Promise.<Boolean>promise();

            var turn = promise.future();

            var previous = inProgress.put(key, turn);

            var ready = previous == null ? Future.<Void>succeededFuture() : previous.<Void>transform(done -> Future.succeededFuture());

            ready.compose(v -> emitNow(candidate))
                .onComplete(result ->
                {
                    inProgress.remove(key, turn);

                    promise.handle(result);
                });

            return turn;
        }
        catch (Exception exception)
        {
            logger.error("Error in emit: {}", exception.getMessage());

            return Future.failedFuture(exception);
        }
    }

    private Future<Boolean> emitNow(AlertCandidate candidate)
    {
        return shouldEmit(candidate.deviceId, candidate.target, candidate.type, candidate.state)
            .compose(emit ->
            {
                if (!emit)
                {
                    logger.debug("Suppressed duplicate {} alert for {} ({})", candidate.type.value(), candidate.target, candidate.state);

                    return Future.succeededFuture(false);
                }

                return alertService.alertCreate(candidate.toJson())
                    .map(created ->
                    {
                        logger.info("Alert raised: {} {} on {} for {}", candidate.severity.value(), candidate.type.value(),
                            candidate.deviceName, candidate.target);

                        notify(candidate, created.getString("created_at"));

                        return true;
                    });
            })
            .onFailure(cause ->
                logger.error("Failed to emit {} alert for {}: {}", candidate.type.value(), candidate.target, cause.getMessage()));
    }

    private void notify(AlertCandidate candidate, String createdAt)
    {
        var timestamp = createdAt != null ? createdAt : clock.instant().toString();

        try
        {
            dispatcher.dispatch(candidate.toNotificationJson(timestamp))
                .onFailure(cause -> logger.warn("Notification for {} alert on {} not delivered: {}",
                    candidate.type.value(), candidate.target, cause.getMessage()));
        }
        catch (Exception exception)
        {
            logger.warn("Notification for {} alert on {} not delivered: {}", candidate.type.value(), candidate.target,
                exception.getMessage());
        }
    }

}
