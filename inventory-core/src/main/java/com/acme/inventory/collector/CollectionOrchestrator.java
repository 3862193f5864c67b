package com.acme.inventory.collector;

import com.acme.inventory.config.CollectorConfig;
import com.acme.inventory.core.CircuitOpenException;
import com.acme.inventory.core.ErrorClassifier;
import com.acme.inventory.core.ErrorKind;
import com.acme.inventory.model.AccountResult;
import com.acme.inventory.model.AccountSession;
import com.acme.inventory.model.AccountTask;
import com.acme.inventory.model.CollectionResult;
import com.acme.inventory.model.CollectionSummary;
import com.acme.inventory.model.FailureDetail;
import com.acme.inventory.model.ResourceDetail;
import com.acme.inventory.model.ResourceItem;
import com.acme.inventory.model.ResourcePage;
import com.acme.inventory.model.ResourceRecord;
import com.acme.inventory.resilience.CircuitBreaker;
import com.acme.inventory.resilience.CircuitBreakerRegistry;
import com.acme.inventory.resilience.GuardedCall;
import com.acme.inventory.spi.ResourceCollector;
import com.acme.inventory.spi.ResourceScanner;
import com.acme.inventory.spi.RoleAssumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Collects one resource type across many accounts with two tiers of bounded concurrency.
 *
 * <p>Accounts run on a pool of {@code maxAccountConcurrency} workers. Inside each account task the
 * role is assumed, the listing is drained page by page, and every listed item's detail is fetched
 * on a per-account pool of {@code maxResourceConcurrency} workers that lives only as long as the
 * account task. Every remote call goes through a {@link GuardedCall} on a breaker shared by name:
 * {@code assume-role}, {@code <service>-list} and {@code <service>-detail}.
 *
 * <p>Remote failures never escape {@link #collect}: each account ends in exactly one
 * {@link AccountResult}, and item failures are counted without aborting their siblings.
 */
public class CollectionOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(CollectionOrchestrator.class);
    static final String MDC_ACCOUNT_ID = "accountId";
    static final String MDC_EXECUTION_ID = "executionId";

    private final RoleAssumer roleAssumer;
    private final CircuitBreakerRegistry breakers;
    private final CollectorConfig config;
    private final ErrorClassifier classifier;

    public CollectionOrchestrator(RoleAssumer roleAssumer, CircuitBreakerRegistry breakers, CollectorConfig config) {
        this.roleAssumer = roleAssumer;
        this.breakers = breakers;
        this.config = config;
        this.classifier = breakers.classifier();
    }

    public CollectionResult collect(ResourceCollector collector, List<AccountTask> accounts) {
        return collect(collector, accounts, config.getMaxAccountConcurrency(), config.getMaxResourceConcurrency());
    }

    public CollectionResult collect(
            ResourceCollector collector,
            List<AccountTask> accounts,
            int maxAccountConcurrency,
            int maxResourceConcurrency) {
        if (maxAccountConcurrency <= 0 || maxResourceConcurrency <= 0) {
            throw new IllegalArgumentException("concurrency limits must be positive (accounts: "
                    + maxAccountConcurrency + ", resources: " + maxResourceConcurrency + ")");
        }
        String executionId = UUID.randomUUID().toString();
        String service = collector.service();
        long started = System.nanoTime();

        Map<String, AccountTask> distinct = new LinkedHashMap<>();
        for (AccountTask task : accounts) {
            if (distinct.putIfAbsent(task.accountId(), task) != null) {
                LOG.warn("Account {} submitted more than once, keeping the first occurrence", task.accountId());
            }
        }
        LOG.info("Starting {} collection {} for {} accounts (accounts in parallel: {}, resources in parallel: {})",
                service, executionId, distinct.size(), maxAccountConcurrency, maxResourceConcurrency);

        Map<String, AccountResult> completed = new ConcurrentHashMap<>();
        Map<String, Future<AccountResult>> futures = new LinkedHashMap<>();
        MDC.put(MDC_EXECUTION_ID, executionId);
        try (BoundedWorkerPool accountPool = new BoundedWorkerPool(service + "-accounts", maxAccountConcurrency)) {
            for (AccountTask task : distinct.values()) {
                futures.put(task.accountId(), accountPool.submit(() -> {
                    AccountResult result = collectAccount(collector, task, maxResourceConcurrency);
                    completed.put(task.accountId(), result);
                    return result;
                }));
            }
            for (Map.Entry<String, Future<AccountResult>> entry : futures.entrySet()) {
                awaitAccount(entry.getKey(), entry.getValue(), completed);
            }
        } finally {
            MDC.remove(MDC_EXECUTION_ID);
        }

        Map<String, AccountResult> ordered = new LinkedHashMap<>();
        for (String accountId : distinct.keySet()) {
            ordered.put(accountId, completed.get(accountId));
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        CollectionSummary summary = CollectionSummary.of(ordered.values(), elapsed);
        LOG.info("Finished {} collection {} in {}ms: {}/{} accounts succeeded ({} failed, {} circuit open), "
                        + "{} resources ({} tagged, {} untagged, {} failed)",
                service, executionId, elapsed.toMillis(), summary.successfulAccounts(), summary.totalAccounts(),
                summary.failedAccounts(), summary.circuitOpenAccounts(), summary.totalResources(),
                summary.taggedResources(), summary.untaggedResources(), summary.failedResources());
        return new CollectionResult(executionId, service, ordered, summary, breakers.snapshots());
    }

    private void awaitAccount(String accountId, Future<AccountResult> future, Map<String, AccountResult> completed) {
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            completed.putIfAbsent(accountId, AccountResult.failed(accountId,
                    new FailureDetail("collect", ErrorKind.UNKNOWN, "Interrupted", "Collection was interrupted")));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Account task for {} failed unexpectedly", accountId, cause);
            completed.putIfAbsent(accountId, AccountResult.failed(accountId, new FailureDetail(
                    "collect", ErrorKind.UNKNOWN, cause.getClass().getSimpleName(), String.valueOf(cause.getMessage()))));
        }
    }

    AccountResult collectAccount(ResourceCollector collector, AccountTask task, int maxResourceConcurrency) {
        String accountId = task.accountId();
        MDC.put(MDC_ACCOUNT_ID, accountId);
        try {
            AccountSession session;
            try {
                session = GuardedCall.of(breakers.get(CollectorConfig.ASSUME_ROLE),
                                () -> roleAssumer.assumeRole(accountId, task.roleName(), task.region()))
                        .execute();
            } catch (Exception e) {
                return failure(accountId, CollectorConfig.ASSUME_ROLE, e, "Could not assume " + task.roleArn());
            }

            String service = collector.service();
            try (ResourceScanner scanner = collector.open(session)) {
                CircuitBreaker listBreaker = breakers.get(CollectorConfig.listOperation(service));
                List<ResourceItem> listed = new ArrayList<>();
                String cursor = null;
                int pages = 0;
                do {
                    String pageCursor = cursor;
                    ResourcePage page;
                    try {
                        page = GuardedCall.of(listBreaker, () -> scanner.listPage(pageCursor)).execute();
                    } catch (Exception e) {
                        return failure(accountId, listBreaker.getName(), e,
                                "Listing failed after " + pages + " page(s)");
                    }
                    pages++;
                    listed.addAll(page.items());
                    cursor = page.hasNext() ? page.nextCursor() : null;
                } while (cursor != null);

                LOG.info("Listed {} {} resources in account {} ({} page(s))", listed.size(), service, accountId, pages);
                return fetchDetails(accountId, service, scanner, listed, maxResourceConcurrency);
            }
        } catch (RuntimeException e) {
            LOG.error("Unexpected error collecting account {}", accountId, e);
            return AccountResult.failed(accountId, new FailureDetail(
                    "collect", ErrorKind.UNKNOWN, classifier.errorCode(e), String.valueOf(e.getMessage())));
        } finally {
            MDC.remove(MDC_ACCOUNT_ID);
        }
    }

    private AccountResult fetchDetails(
            String accountId,
            String service,
            ResourceScanner scanner,
            List<ResourceItem> listed,
            int maxResourceConcurrency) {
        CircuitBreaker detailBreaker = breakers.get(CollectorConfig.detailOperation(service));
        List<Future<ResourceRecord>> futures = new ArrayList<>(listed.size());
        List<ResourceRecord> records = new ArrayList<>(listed.size());
        int failed = 0;

        try (BoundedWorkerPool resourcePool = new BoundedWorkerPool(service + "-" + accountId, maxResourceConcurrency)) {
            for (ResourceItem item : listed) {
                futures.add(resourcePool.submit(() -> {
                    ResourceDetail detail = GuardedCall.of(detailBreaker, () -> scanner.getDetail(item)).execute();
                    return ResourceRecord.from(accountId, service, item, detail);
                }));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    records.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    failed++;
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof CircuitOpenException) {
                        LOG.debug("Skipped {} {}: circuit {} is open",
                                service, listed.get(i).resourceId(), detailBreaker.getName());
                    } else {
                        LOG.warn("Failed to fetch {} {} in account {} ({}: {})", service, listed.get(i).resourceId(),
                                accountId, classifier.errorCode(cause), cause.getMessage());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    failed += futures.size() - i;
                    futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                    break;
                }
            }
        }

        AccountResult result = AccountResult.success(accountId, records, failed);
        LOG.info("Account {} completed: {} resources ({} tagged, {} untagged), {} failed",
                accountId, result.statistics().total(), result.statistics().tagged(),
                result.statistics().untagged(), failed);
        return result;
    }

    private AccountResult failure(String accountId, String operation, Exception e, String context) {
        if (e instanceof CircuitOpenException) {
            LOG.warn("Account {}: {} circuit is open, skipping", accountId, operation);
            return AccountResult.circuitOpen(accountId, new FailureDetail(
                    operation, ErrorKind.TRANSIENT, CircuitOpenException.ERROR_CODE, context + ": " + e.getMessage()));
        }
        ErrorKind kind = classifier.classify(e);
        String code = classifier.errorCode(e);
        LOG.warn("Account {}: {} failed ({} {}): {}", accountId, operation, kind, code, e.getMessage());
        return AccountResult.failed(accountId, new FailureDetail(operation, kind, code, context + ": " + e.getMessage()));
    }
}
