package com.kmesh.router.agent;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.util.function.Supplier;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

/**
 * Request factory whose connect and read timeouts shrink to the budget of the recall running on
 * the current thread. The configured agent timeout stays the upper bound.
 */
public class CallBudgetRequestFactory extends SimpleClientHttpRequestFactory {
    private static final ThreadLocal<Long> CALL_BUDGET_MS = new ThreadLocal<>();

    private final int maxTimeoutMs;

    public CallBudgetRequestFactory(long maxTimeoutMs) {
        this.maxTimeoutMs = (int) Math.min(Integer.MAX_VALUE, Math.max(1L, maxTimeoutMs));
        setConnectTimeout(this.maxTimeoutMs);
        setReadTimeout(this.maxTimeoutMs);
    }

    static <T> T withinBudget(Long budgetMs, Supplier<T> call) {
        Long previous = CALL_BUDGET_MS.get();
        CALL_BUDGET_MS.set(budgetMs);
        try {
            return call.get();
        } finally {
            if (previous == null) {
                CALL_BUDGET_MS.remove();
            } else {
                CALL_BUDGET_MS.set(previous);
            }
        }
    }

    @Override
    protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
        super.prepareConnection(connection, httpMethod);
        Long budget = CALL_BUDGET_MS.get();
        if (budget != null && budget > 0) {
            int timeoutMs = (int) Math.min(maxTimeoutMs, budget);
            connection.setConnectTimeout(timeoutMs);
            connection.setReadTimeout(timeoutMs);
        }
    }
}
