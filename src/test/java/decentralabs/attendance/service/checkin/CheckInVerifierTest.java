package decentralabs.attendance.service.checkin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import decentralabs.attendance.config.AttendanceProperties;
import decentralabs.attendance.service.geo.GeoPoint;
import decentralabs.attendance.service.geo.GeoTestPoints;
import decentralabs.attendance.service.geo.GeoValidator;
import decentralabs.attendance.service.geo.GeofenceResult;
import decentralabs.attendance.service.persistence.AttendancePersistenceService;
import decentralabs.attendance.service.session.AttendanceSession;
import decentralabs.attendance.service.session.SessionManager;
import decentralabs.attendance.service.time.MutableClockSource;
import decentralabs.attendance.service.token.AttendanceToken;
import decentralabs.attendance.service.token.TokenPayloadCodec;
import decentralabs.attendance.service.token.TokenStatus;
import decentralabs.attendance.service.token.TokenStore;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("CheckInVerifier Tests")
class CheckInVerifierTest {

    private static final Instant T0 = Instant.parse("2026-03-02T09:00:00Z");
    private static final GeoPoint ORIGIN = GeoPoint.of(5.6508, -0.1870);
    private static final String LECTURER = "lecturer@uni.example";
    private static final String STUDENT = "student-0042";

    private AttendanceProperties properties;
    private MutableClockSource clock;
    private TokenStore tokenStore;
    private TokenPayloadCodec payloadCodec;
    private AttendancePersistenceService persistence;
    private SessionManager sessionManager;
    private GeoValidator geoValidator;
    private AttendanceLedger ledger;
    private CheckInVerifier verifier;

    @BeforeEach
    void setUp() {
        properties = new AttendanceProperties();
        properties.getToken().setPayloadSecret("unit-test-secret");
        clock = new MutableClockSource(T0);
        tokenStore = new TokenStore();
        payloadCodec = new TokenPayloadCodec(properties);
        persistence = mock(AttendancePersistenceService.class);
        sessionManager = new SessionManager(properties, clock, tokenStore, payloadCodec, persistence);
        geoValidator = new GeoValidator();
        ledger = new AttendanceLedger();
        rebuildVerifier();
    }

    private void rebuildVerifier() {
        verifier = new CheckInVerifier(tokenStore, sessionManager, geoValidator, ledger, clock, payloadCodec, persistence);
    }

    private AttendanceSession openSession(double radiusMeters) {
        return sessionManager.openSession(LECTURER, radiusMeters, ORIGIN, Duration.ofHours(1), "Distributed Systems");
    }

    private static CheckInCommand atOrigin(AttendanceToken token, String attendee) {
        return new CheckInCommand(token.getId(), attendee, ORIGIN, null);
    }

    @Nested
    @DisplayName("Acceptance Tests")
    class AcceptanceTests {

        @Test
        @DisplayName("Should accept a valid check-in and record it with server time")
        void shouldAcceptValidCheckIn() {
            AttendanceSession session = openSession(100);
            AttendanceToken token = sessionManager.issueToken(session.id(), LECTURER);
            clock.advance(Duration.ofMinutes(3));
            GeoPoint nearby = GeoTestPoints.north(ORIGIN, 25);

            VerificationResult result = verifier.verify(
                new CheckInCommand(token.getId(), STUDENT, nearby, T0.minus(Duration.ofDays(1)))
            );

            assertThat(result.isAccepted()).isTrue();
            assertThat(result.record().sessionId()).isEqualTo(session.id());
            assertThat(result.record().attendeeIdentity()).isEqualTo(STUDENT);
            assertThat(result.record().verifiedAt()).isEqualTo(T0.plus(Duration.ofMinutes(3)));
            assertThat(result.record().distanceMeters()).isCloseTo(25.0, within(0.5));
            assertThat(ledger.find(session.id(), STUDENT)).contains(result.record());
            assertThat(tokenStore.get(token.getId()).orElseThrow().isConsumedBy(STUDENT)).isTrue();
            verify(persistence).insertRecord(result.record());
        }

        @Test
        @DisplayName("Should accept a check-in made with the scanned payload")
        void shouldAcceptPayload() {
            AttendanceSession session = openSession(100);
            AttendanceToken token = sessionManager.issueToken(session.id(), LECTURER);

            VerificationResult result = verifier.verifyPayload(
                token.getPayload(), new CheckInCommand(null, STUDENT, ORIGIN, null)
            );

            assertThat(result.outcome()).isEqualTo(CheckInOutcome.ACCEPTED);
            assertThat(result.record().tokenId()).isEqualTo(token.getId());
        }

        @Test
        @DisplayName("Should let many attendees share one token")
        void shouldAcceptManyAttendees() {
            AttendanceSession session = openSession(100);
            AttendanceToken token = sessionManager.issueToken(session.id(), LECTURER);

            for (int i = 0; i < 10; i++) {
                assertThat(verifier.verify(atOrigin(token, "student-" + i)).isAccepted()).isTrue();
            }

            assertThat(ledger.countBySession(session.id())).isEqualTo(10);
        }

        @Test
        @DisplayName("Should keep accepting an unexpired token after the session is closed")
        void shouldAcceptAfterClose() {
            AttendanceSession session = openSession(100);
            AttendanceToken token = sessionManager.issueToken(session.id(), LECTURER);
            clock.advance(Duration.ofMinutes(20));
            sessionManager.closeSession(session.id(), LECTURER);
            clock.advance(Duration.ofSeconds(1));

            VerificationResult result = verifier.verify(atOrigin(token, STUDENT));

            assertThat(result.outcome()).isEqualTo(CheckInOutcome.ACCEPTED);
        }
    }

    @Nested
    @DisplayName("Duplicate Tests")
    class DuplicateTests {

        @Test
        @DisplayName("Should accept exactly one of 50 concurrent check-ins by the same attendee")
        void shouldAcceptExactlyOnceUnderContention() throws Exception {
            AttendanceSession session = openSession(100);
            AttendanceToken token = sessionManager.issueToken(session.id(), LECTURER);
            int attempts = 50;
            ExecutorService executor = Executors.newFixedThreadPool(attempts);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<VerificationResult>> futures = new ArrayList<>();
                for (int i = 0; i < attempts; i++) {
                    Callable<VerificationResult> attempt = () -> {
                        start.await();
                        return verifier.verify(atOrigin(token, STUDENT));
                    };
                    futures.add(executor.submit(attempt));
                }
                start.countDown();

                List<CheckInOutcome> outcomes = new ArrayList<>();
                for (Future<VerificationResult> future : futures) {
                    outcomes.add(future.get(10, TimeUnit.SECONDS).outcome());
                }
                assertThat(outcomes).filteredOn(outcome -> outcome == CheckInOutcome.ACCEPTED).hasSize(1);
                assertThat(outcomes).filteredOn(outcome -> outcome == CheckInOutcome.DUPLICATE_CHECK_IN)
                    .hasSize(attempts - 1);
            } finally {
                executor.shutdownNow();
            }
            assertThat(ledger.countBySession(session.id())).isEqualTo(1);
            verify(persistence, times(1)).insertRecord(any());
        }

        @Test
        @DisplayName("Should report a repeat check-in with the same token as duplicate")
        void shouldRejectRepeat() {
            AttendanceSession session = openSession(100);
            AttendanceToken token = sessionManager.issueToken(session.id(), LECTURER);
            verifier.verify(atOrigin(token, STUDENT));

            VerificationResult repeat = verifier.verify(atOrigin(token, STUDENT));

            assertThat(repeat.outcome()).isEqualTo(CheckInOutcome.DUPLICATE_CHECK_IN);
            assertThat(repeat.record()).isNull();
        }

        @Test
        @DisplayName("Should report a check-in with a rotated token of the same session as duplicate")
        void shouldRejectRepeatWithRotatedToken() {
            properties.getToken().setRotationEnabled(true);
            AttendanceSession session = openSession(100);
            AttendanceToken first = sessionManager.issueToken(session.id(), LECTURER);
            verifier.verify(atOrigin(first, STUDENT));
            clock.advance(Duration.ofSeconds(20));
            AttendanceToken second = sessionManager.issueToken(session.id(), LECTURER);

            VerificationResult repeat = verifier.verify(atOrigin(second, STUDENT));

            assertThat(second.getId()).isNotEqualTo(first.getId());
            assertThat(repeat.outcome()).isEqualTo(CheckInOutcome.DUPLICATE_CHECK_IN);
            assertThat(tokenStore.get(second.getId()).orElseThrow().isConsumedBy(STUDENT)).isFalse();
        }
        @Test
        @DisplayName("Should list an attendee on exactly the token of their record when racing two rotated tokens")
        void shouldKeepConsumersConsistentAcrossRotatedTokens() throws Exception {
            properties.getToken().setRotationEnabled(true);
            AttendanceSession session = openSession(100);
            AttendanceToken first = sessionManager.issueToken(session.id(), LECTURER);
            AttendanceToken second = sessionManager.issueToken(session.id(), LECTURER);
            ExecutorService executor = Executors.newFixedThreadPool(2);
            try {
                for (int round = 0; round < 300; round++) {
                    String attendee = "student-" + round;
                    CountDownLatch start = new CountDownLatch(1);
                    Future<VerificationResult> viaFirst = executor.submit(() -> {
                        start.await();
                        return verifier.verify(atOrigin(first, attendee));
                    });
                    Future<VerificationResult> viaSecond = executor.submit(() -> {
                        start.await();
                        return verifier.verify(atOrigin(second, attendee));
                    });
                    start.countDown();

                    List<CheckInOutcome> outcomes = List.of(
                        viaFirst.get(10, TimeUnit.SECONDS).outcome(),
                        viaSecond.get(10, TimeUnit.SECONDS).outcome()
                    );
                    assertThat(outcomes).containsExactlyInAnyOrder(
                        CheckInOutcome.ACCEPTED, CheckInOutcome.DUPLICATE_CHECK_IN
                    );

                    String recordedToken = ledger.find(session.id(), attendee).orElseThrow().tokenId();
                    for (AttendanceToken token : List.of(first, second)) {
                        boolean listed = tokenStore.get(token.getId()).orElseThrow().isConsumedBy(attendee);
                        assertThat(listed)
                            .as("round %d, token listed iff it carries the record", round)
                            .isEqualTo(token.getId().equals(recordedToken));
                    }
                }
            } finally {
                executor.shutdownNow();
            }
        }

        @Test
        @DisplayName("Should let the same attendee retry after a rejected attempt")
        void shouldReleaseSlotAfterRejection() {
            AttendanceSession session = openSession(100);
            AttendanceToken revoked = sessionManager.issueToken(session.id(), LECTURER);
            sessionManager.revokeToken(revoked.getId(), LECTURER);

            assertThat(verifier.verify(atOrigin(revoked, STUDENT)).outcome()).isEqualTo(CheckInOutcome.TOKEN_EXPIRED);
            AttendanceToken fresh = sessionManager.issueToken(session.id(), LECTURER);

            assertThat(verifier.verify(atOrigin(fresh, STUDENT)).outcome()).isEqualTo(CheckInOutcome.ACCEPTED);
        }
    }

    @Nested
    @DisplayName("Persistence Tests")
    class PersistenceTests {

        @Test
        @DisplayName("Should mirror each check-in as its own record row and never rewrite the token")
        void shouldMirrorCheckInsAsRecords() {
            AttendanceSession session = openSession(100);
            AttendanceToken token = sessionManager.issueToken(session.id(), LECTURER);
            clearInvocations(persistence);

            VerificationResult alice = verifier.verify(atOrigin(token, "alice"));
            VerificationResult bob = verifier.verify(atOrigin(token, "bob"));

            ArgumentCaptor<AttendanceRecord> records = ArgumentCaptor.forClass(AttendanceRecord.class);
            verify(persistence, times(2)).insertRecord(records.capture());
            assertThat(records.getAllValues()).containsExactly(alice.record(), bob.record());
            assertThat(records.getAllValues()).extracting(AttendanceRecord::tokenId).containsOnly(token.getId());
            verify(persistence, never()).saveToken(any());
        }
    }

    @Nested
    @DisplayName("Expiry Tests")
    class ExpiryTests {

        @Test
        @DisplayName("Should accept one second before expiry and reject one second after")
        void shouldHonourExpiry() {
            properties.getToken().setRotationEnabled(true);
            properties.getToken().setTtl(Duration.ofSeconds(60));
            AttendanceSession session = openSession(100);
            AttendanceToken token = sessionManager.issueToken(session.id(), LECTURER);

            clock.set(T0.plusSeconds(59));
            VerificationResult early = verifier.verify(atOrigin(token, STUDENT));
            clock.set(T0.plusSeconds(61));
            VerificationResult late = verifier.verify(atOrigin(token, "student-0043"));

            assertThat(early.outcome()).isEqualTo(CheckInOutcome.ACCEPTED);
            assertThat(late.outcome()).isEqualTo(CheckInOutcome.TOKEN_EXPIRED);
        }

        @Test
        @DisplayName("Should reject a revoked token as expired")
        void shouldRejectRevokedToken() {
            AttendanceSession session = openSession(100);
            AttendanceToken token = sessionManager.issueToken(session.id(), LECTURER);
            sessionManager.revokeToken(token.getId(), LECTURER);

            VerificationResult result = verifier.verify(atOrigin(token, STUDENT));

            assertThat(result.outcome()).isEqualTo(CheckInOutcome.TOKEN_EXPIRED);
            verify(persistence, never()).insertRecord(any());
        }

        @Test
        @DisplayName("Should check expiry before location")
        void shouldCheckExpiryBeforeLocation() {
            properties.getToken().setRotationEnabled(true);
            AttendanceSession session = openSession(100);
            AttendanceToken token = sessionManager.issueToken(session.id(), LECTURER);
            clock.advance(Duration.ofMinutes(5));

            VerificationResult result = verifier.verify(
                new CheckInCommand(token.getId(), STUDENT, GeoTestPoints.north(ORIGIN, 5_000), null)
            );

            assertThat(result.outcome()).isEqualTo(CheckInOutcome.TOKEN_EXPIRED);
        }

        @Test
        @DisplayName("Should not accept a token revoked while verification is in flight")
        void shouldRejectTokenRevokedMidFlight() {
            AttendanceSession session = openSession(100);
            AttendanceToken token = sessionManager.issueToken(session.id(), LECTURER);
            geoValidator = spy(new GeoValidator());
            doAnswer(invocation -> {
                GeofenceResult result = (GeofenceResult) invocation.callRealMethod();
                sessionManager.revokeToken(token.getId(), LECTURER);
                return result;
            }).when(geoValidator).evaluate(any(), any(), anyDouble());
            rebuildVerifier();

            VerificationResult result = verifier.verify(atOrigin(token, STUDENT));

            assertThat(result.isAccepted()).isFalse();
            assertThat(result.outcome()).isEqualTo(CheckInOutcome.TOKEN_EXPIRED);
            assertThat(tokenStore.get(token.getId()).orElseThrow().getStatus()).isEqualTo(TokenStatus.REVOKED);
            assertThat(ledger.hasRecord(session.id(), STUDENT)).isFalse();
        }
    }

    @Nested
    @DisplayName("Location Tests")
    class LocationTests {

        @Test
        @DisplayName("Should reject 200m and accept 99m against a 100m radius")
        void shouldApplyRadius() {
            AttendanceSession session = openSession(100);
            AttendanceToken token = sessionManager.issueToken(session.id(), LECTURER);

            VerificationResult far = verifier.verify(
                new CheckInCommand(token.getId(), STUDENT, GeoTestPoints.north(ORIGIN, 200), null)
            );
            VerificationResult near = verifier.verify(
                new CheckInCommand(token.getId(), STUDENT, GeoTestPoints.north(ORIGIN, 99), null)
            );

            assertThat(far.outcome()).isEqualTo(CheckInOutcome.OUT_OF_RANGE);
            assertThat(near.outcome()).isEqualTo(CheckInOutcome.ACCEPTED);
        }

        @Test
        @DisplayName("Should leave no trace of an out-of-range attempt")
        void shouldNotConsumeOnOutOfRange() {
            AttendanceSession session = openSession(100);
            AttendanceToken token = sessionManager.issueToken(session.id(), LECTURER);

            verifier.verify(new CheckInCommand(token.getId(), STUDENT, GeoTestPoints.north(ORIGIN, 500), null));

            assertThat(tokenStore.get(token.getId()).orElseThrow().getConsumedBy()).isEmpty();
            assertThat(ledger.hasRecord(session.id(), STUDENT)).isFalse();
        }

        @Test
        @DisplayName("Should reject missing or invalid location fixes")
        void shouldRejectMissingFix() {
            AttendanceSession session = openSession(100_000);
            AttendanceToken token = sessionManager.issueToken(session.id(), LECTURER);

            assertThat(verifier.verify(new CheckInCommand(token.getId(), STUDENT, null, null)).outcome())
                .isEqualTo(CheckInOutcome.OUT_OF_RANGE);
            assertThat(verifier.verify(new CheckInCommand(token.getId(), STUDENT, new GeoPoint(5.65, null), null)).outcome())
                .isEqualTo(CheckInOutcome.OUT_OF_RANGE);
            assertThat(verifier.verify(new CheckInCommand(token.getId(), STUDENT, GeoPoint.of(Double.NaN, 0), null)).outcome())
                .isEqualTo(CheckInOutcome.OUT_OF_RANGE);
        }
    }

    @Nested
    @DisplayName("Lookup Tests")
    class LookupTests {

        @Test
        @DisplayName("Should report unknown tokens as not found")
        void shouldRejectUnknownToken() {
            openSession(100);

            VerificationResult result = verifier.verify(new CheckInCommand("ABCDEF", STUDENT, ORIGIN, null));

            assertThat(result.outcome()).isEqualTo(CheckInOutcome.TOKEN_NOT_FOUND);
            assertThat(result.outcome().isRetryable()).isTrue();
        }

        @Test
        @DisplayName("Should report tampered payloads as not found")
        void shouldRejectTamperedPayload() {
            AttendanceSession session = openSession(100);
            AttendanceToken token = sessionManager.issueToken(session.id(), LECTURER);
            String payload = token.getPayload();
            char last = payload.charAt(payload.length() - 1);
            String tampered = payload.substring(0, payload.length() - 1) + (last == '0' ? '1' : '0');

            VerificationResult result = verifier.verifyPayload(tampered, new CheckInCommand(null, STUDENT, ORIGIN, null));

            assertThat(result.outcome()).isEqualTo(CheckInOutcome.TOKEN_NOT_FOUND);
            assertThat(tokenStore.get(token.getId()).orElseThrow().getConsumedBy()).isEmpty();
        }

        @Test
        @DisplayName("Should refuse requests without an attendee")
        void shouldRefuseMissingAttendee() {
            assertThatThrownBy(() -> verifier.verify(null)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> verifier.verify(new CheckInCommand("x", " ", ORIGIN, null)))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
