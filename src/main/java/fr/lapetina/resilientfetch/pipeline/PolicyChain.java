package fr.lapetina.resilientfetch.pipeline;

import fr.lapetina.resilientfetch.domain.model.FetchRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Ordered list of policies, outermost first, executed around a terminal invocation.
 *
 * The chain is immutable and can be shared between concurrent calls; per call state lives
 * in the futures each policy creates.
 */
public final class PolicyChain {

    private static final PolicyChain EMPTY = new PolicyChain(List.of());

    private final List<Policy> policies;

    public PolicyChain(List<Policy> policies) {
        this.policies = List.copyOf(policies);
    }

    public static PolicyChain empty() {
        return EMPTY;
    }

    public static PolicyChain of(Policy... policies) {
        return new PolicyChain(List.of(policies));
    }

    /**
     * Returns a chain running this chain's policies around {@code inner}'s.
     */
    public PolicyChain then(PolicyChain inner) {
        List<Policy> combined = new ArrayList<>(policies);
        combined.addAll(inner.policies);
        return new PolicyChain(combined);
    }

    public <R> CompletableFuture<R> execute(FetchRequest request, Invocation<R> terminal) {
        Invocation<R> current = guard(terminal);
        for (int i = policies.size() - 1; i >= 0; i--) {
            Policy policy = policies.get(i);
            Invocation<R> inner = current;
            current = guard(forwarded -> policy.apply(forwarded, inner));
        }
        return Futures.invoke(current, request);
    }

    public List<Policy> policies() {
        return policies;
    }

    public boolean isEmpty() {
        return policies.isEmpty();
    }

    private static <R> Invocation<R> guard(Invocation<R> invocation) {
        return request -> Futures.invoke(invocation, request);
    }

    @Override
    public String toString() {
        return policies.stream().map(Policy::name).collect(Collectors.joining(" -> ", "PolicyChain[", "]"));
    }
}
