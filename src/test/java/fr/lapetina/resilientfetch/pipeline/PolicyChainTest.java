package fr.lapetina.resilientfetch.pipeline;

import fr.lapetina.resilientfetch.domain.model.FetchRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PolicyChainTest {

    private static final FetchRequest REQUEST = FetchRequest.of("https://api.example.com/test");

    private static Policy recording(String name, List<String> events) {
        return new Policy() {
            @Override
            public <R> CompletableFuture<R> apply(FetchRequest request, Invocation<R> next) {
                events.add("enter " + name);
                return next.proceed(request).whenComplete((value, failure) -> events.add("exit " + name));
            }

            @Override
            public String name() {
                return name;
            }
        };
    }

    @Test
    @DisplayName("should run policies outermost first")
    void shouldNestPoliciesInOrder() throws Exception {
        List<String> events = new CopyOnWriteArrayList<>();
        PolicyChain chain = PolicyChain.of(recording("outer", events))
                .then(PolicyChain.of(recording("inner", events)));

        String result = chain.<String>execute(REQUEST, request -> {
            events.add("call");
            return CompletableFuture.completedFuture("done");
        }).get(5, TimeUnit.SECONDS);

        assertThat(result).isEqualTo("done");
        assertThat(events).containsExactly("enter outer", "enter inner", "call", "exit inner", "exit outer");
        assertThat(chain.toString()).isEqualTo("PolicyChain[outer -> inner]");
    }

    @Test
    @DisplayName("should call the terminal directly when empty")
    void shouldRunTerminalWhenEmpty() throws Exception {
        String result = PolicyChain.empty()
                .<String>execute(REQUEST, request -> CompletableFuture.completedFuture(request.url()))
                .get(5, TimeUnit.SECONDS);

        assertThat(result).isEqualTo("https://api.example.com/test");
        assertThat(PolicyChain.empty().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("should turn a throwing terminal into a failed future")
    void shouldCaptureTerminalException() {
        CompletableFuture<String> future = PolicyChain.empty().execute(REQUEST, request -> {
            throw new IllegalStateException("terminal");
        });

        assertThatThrownBy(() -> future.get(5, TimeUnit.SECONDS))
                .cause()
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("terminal");
    }
}
