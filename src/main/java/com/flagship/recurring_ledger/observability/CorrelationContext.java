package com.flagship.recurring_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Correlation id and ledger scope of the work running on the current thread.
 *
 * HTTP requests take their id from {@code X-Correlation-ID}; scheduled jobs get one prefixed
 * with the job name. While an account or template is being worked on, its id is in the MDC
 * as well, so log lines can be grepped per account or per template.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";
    public static final String TEMPLATE_ID_MDC_KEY = "templateId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Starts a request with the caller's id, or a fresh one if the caller sent none.
     *
     * @return the id in effect
     */
    public static String beginRequest(String incomingId) {
        String id = incomingId != null && !incomingId.isBlank() ? incomingId.strip() : shortId();
        bind(id);
        return id;
    }

    /**
     * Starts a scheduled job run, e.g. {@code sync-3f9a1c2e}.
     */
    public static String beginJob(String jobName) {
        String id = jobName + "-" + shortId();
        bind(id);
        return id;
    }

    public static String currentId() {
        return correlationId.get();
    }

    /**
     * Puts the account id in the MDC until the returned scope is closed.
     */
    public static MDC.MDCCloseable forAccount(UUID accountId) {
        return MDC.putCloseable(ACCOUNT_ID_MDC_KEY, accountId.toString());
    }

    /**
     * Puts the template id in the MDC until the returned scope is closed.
     */
    public static MDC.MDCCloseable forTemplate(UUID templateId) {
        return MDC.putCloseable(TEMPLATE_ID_MDC_KEY, templateId.toString());
    }

    public static void end() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(ACCOUNT_ID_MDC_KEY);
        MDC.remove(TEMPLATE_ID_MDC_KEY);
    }

    private static void bind(String id) {
        correlationId.set(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
    }

    private static String shortId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
