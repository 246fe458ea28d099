package com.tokenbroker.sdk.credential;

import com.tokenbroker.sdk.auth.AuthState;
import com.tokenbroker.sdk.exception.NoCredentialException;
import com.tokenbroker.sdk.token.BearerToken;
import com.tokenbroker.sdk.token.TokenFacade;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CredentialResolverTest {

    private static final CredentialRequest REQUEST = CredentialRequest.builder("mypkg")
            .scope("https://www.googleapis.com/auth/userinfo.email")
            .build();

    @Test
    void returnsTokenOfOnlySucceedingStrategyAtAnyPosition() {
        for (int position = 0; position < 4; position++) {
            TokenFacade expected = BearerToken.of("tok-" + position);
            List<CountingStrategy> strategies = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                strategies.add(i == position
                        ? CountingStrategy.succeeding("s" + i, expected)
                        : CountingStrategy.notApplicable("s" + i));
            }

            TokenFacade resolved = CredentialResolver.builder().build().resolve(REQUEST, strategies);

            assertSame(expected, resolved, "success at position " + position);
        }
    }

    @Test
    void strategiesAfterFirstSuccessAreNeverEvaluated() {
        CountingStrategy first = CountingStrategy.notApplicable("first");
        CountingStrategy winner = CountingStrategy.succeeding("winner", BearerToken.of("tok"));
        CountingStrategy later = CountingStrategy.succeeding("later", BearerToken.of("other"));

        CredentialResolver resolver = CredentialResolver.builder()
                .strategy(first)
                .strategy(winner)
                .strategy(later)
                .build();

        TokenFacade token = resolver.resolve(REQUEST);

        assertEquals("tok", token.accessToken());
        assertEquals(1, first.getCalls());
        assertEquals(1, winner.getCalls());
        assertEquals(0, later.getCalls());
    }

    @Test
    void firstOfSeveralSuccessesWins() {
        TokenFacade first = BearerToken.of("first");
        CredentialResolver resolver = CredentialResolver.builder()
                .strategy(CountingStrategy.succeeding("a", first))
                .strategy(CountingStrategy.succeeding("b", BearerToken.of("second")))
                .build();

        assertSame(first, resolver.resolve(REQUEST));
    }

    @Test
    void allNotApplicableFailsWithOneAttemptPerStrategy() {
        CredentialResolver resolver = CredentialResolver.builder()
                .strategy(CountingStrategy.notApplicable("explicit"))
                .strategy(CountingStrategy.notApplicable("service-account"))
                .strategy(CountingStrategy.notApplicable("ambient"))
                .build();

        NoCredentialException ex = assertThrows(NoCredentialException.class, () -> resolver.resolve(REQUEST));

        List<CredentialAttempt> attempts = ex.getAttempts();
        assertEquals(3, attempts.size());
        assertEquals("explicit", attempts.get(0).strategyName());
        assertEquals("service-account", attempts.get(1).strategyName());
        assertEquals("ambient", attempts.get(2).strategyName());
        assertEquals("explicit not applicable", attempts.get(0).reason());
        assertEquals("ambient not applicable", attempts.get(2).reason());
        assertFalse(attempts.get(0).isFailure());
        assertTrue(ex.getMessage().contains("service-account: service-account not applicable"));
        assertEquals("NO_CREDENTIAL", ex.getErrorCode());
    }

    @Test
    void failureIsRecordedAndLaterStrategyCanSucceedByDefault() {
        IllegalArgumentException broken = new IllegalArgumentException("malformed key file");
        CountingStrategy failing = CountingStrategy.failing("service-account", broken);
        TokenFacade expected = BearerToken.of("ambient-token");

        CredentialResolver resolver = CredentialResolver.builder()
                .strategy(failing)
                .strategy(CountingStrategy.succeeding("ambient", expected))
                .build();

        assertEquals(FailurePolicy.CONTINUE, resolver.getFailurePolicy());
        assertSame(expected, resolver.resolve(REQUEST));
        assertEquals(1, failing.getCalls());
    }

    @Test
    void failuresAreReportedWhenAllStrategiesAreExhausted() {
        IllegalArgumentException broken = new IllegalArgumentException("malformed key file");
        CredentialResolver resolver = CredentialResolver.builder()
                .strategy(CountingStrategy.failing("service-account", broken))
                .strategy(CountingStrategy.notApplicable("ambient"))
                .build();

        NoCredentialException ex = assertThrows(NoCredentialException.class, () -> resolver.resolve(REQUEST));

        CredentialAttempt failed = ex.getAttempts().get(0);
        assertTrue(failed.isFailure());
        assertSame(broken, failed.error());
        assertEquals("malformed key file", failed.reason());
        assertFalse(ex.getAttempts().get(1).isFailure());
    }

    @Test
    void abortPolicyStopsAtFirstFailure() {
        IllegalArgumentException broken = new IllegalArgumentException("malformed key file");
        CountingStrategy later = CountingStrategy.succeeding("ambient", BearerToken.of("tok"));

        CredentialResolver resolver = CredentialResolver.builder()
                .strategy(CountingStrategy.notApplicable("explicit"))
                .strategy(CountingStrategy.failing("service-account", broken))
                .strategy(later)
                .failurePolicy(FailurePolicy.ABORT)
                .build();

        NoCredentialException ex = assertThrows(NoCredentialException.class, () -> resolver.resolve(REQUEST));

        assertEquals(2, ex.getAttempts().size());
        assertSame(broken, ex.getCause());
        assertEquals(0, later.getCalls());
    }

    @Test
    void throwingStrategyIsTreatedAsFailure() {
        CredentialStrategy throwing = new CredentialStrategy() {
            @Override
            public String name() {
                return "throwing";
            }

            @Override
            public StrategyOutcome attempt(CredentialRequest request) {
                throw new IllegalStateException("boom");
            }
        };
        TokenFacade expected = BearerToken.of("tok");

        CredentialResolver resolver = CredentialResolver.builder()
                .strategy(throwing)
                .strategy(CountingStrategy.succeeding("next", expected))
                .build();

        assertSame(expected, resolver.resolve(REQUEST));
    }

    @Test
    void unrecognizedOutcomeIsTreatedAsFailure() {
        CredentialStrategy odd = new CredentialStrategy() {
            @Override
            public String name() {
                return "odd";
            }

            @Override
            public StrategyOutcome attempt(CredentialRequest request) {
                return new StrategyOutcome() {
                };
            }
        };

        CredentialResolver resolver = CredentialResolver.builder()
                .strategy(odd)
                .failurePolicy(FailurePolicy.ABORT)
                .build();

        NoCredentialException ex = assertThrows(NoCredentialException.class, () -> resolver.resolve(REQUEST));
        assertEquals(1, ex.getAttempts().size());
    }

    @Test
    void emptyStrategyListFailsWithNoAttempts() {
        CredentialResolver resolver = CredentialResolver.builder().build();

        NoCredentialException ex = assertThrows(NoCredentialException.class,
                () -> resolver.resolve(REQUEST, Collections.emptyList()));
        assertTrue(ex.getAttempts().isEmpty());
    }

    @Test
    void populateInstallsWinningTokenIntoAuthState() {
        AuthState state = AuthState.builder("mypkg").build();
        TokenFacade expected = BearerToken.of("tok");
        CredentialResolver resolver = CredentialResolver.builder()
                .strategy(CountingStrategy.succeeding("explicit", expected))
                .build();

        TokenFacade installed = resolver.populate(state, REQUEST);

        assertSame(expected, installed);
        assertSame(expected, state.getCred().orElseThrow());
        assertTrue(state.isActive());
    }

    @Test
    void builderRejectsNullPolicy() {
        assertThrows(IllegalStateException.class,
                () -> CredentialResolver.builder().failurePolicy(null).build());
    }

    static final class CountingStrategy implements CredentialStrategy {
        private final String name;
        private final StrategyOutcome outcome;
        private int calls;

        private CountingStrategy(String name, StrategyOutcome outcome) {
            this.name = name;
            this.outcome = outcome;
        }

        static CountingStrategy succeeding(String name, TokenFacade token) {
            return new CountingStrategy(name, StrategyOutcome.success(token));
        }

        static CountingStrategy notApplicable(String name) {
            return new CountingStrategy(name, StrategyOutcome.notApplicable(name + " not applicable"));
        }

        static CountingStrategy failing(String name, Throwable error) {
            return new CountingStrategy(name, StrategyOutcome.failure(error));
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public StrategyOutcome attempt(CredentialRequest request) {
            calls++;
            return outcome;
        }

        int getCalls() {
            return calls;
        }
    }
}
