package com.z254.bulwark.governance.state;

import com.z254.bulwark.governance.error.IntegrityException;
import com.z254.bulwark.governance.error.ValidationException;
import com.z254.bulwark.governance.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StateContainer}.
 */
class StateContainerTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
    }

    private static double totalProbability(StateContainer container) {
        return container.getAmplitudes().stream().mapToDouble(Amplitude::probability).sum();
    }

    private static Amplitude[][] identity(int dimension) {
        Amplitude[][] matrix = new Amplitude[dimension][dimension];
        for (int row = 0; row < dimension; row++) {
            for (int col = 0; col < dimension; col++) {
                matrix[row][col] = row == col ? Amplitude.of(1, 0) : Amplitude.ZERO;
            }
        }
        return matrix;
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @ParameterizedTest
        @ValueSource(ints = {2, 3, 16, 256})
        @DisplayName("should create normalized state of requested dimension")
        void createNormalizedState(int dimension) {
            StateContainer container = StateContainer.create(dimension, clock);

            assertThat(container.getDimension()).isEqualTo(dimension);
            assertThat(container.getAmplitudes()).hasSize(dimension);
            assertThat(Math.abs(totalProbability(container) - 1.0)).isLessThan(1e-9);
            assertThat(container.verify()).isTrue();
        }

        @Test
        @DisplayName("should clamp dimension into [2, 256]")
        void clampDimension() {
            assertThat(StateContainer.create(0, clock).getDimension()).isEqualTo(2);
            assertThat(StateContainer.create(-5, clock).getDimension()).isEqualTo(2);
            assertThat(StateContainer.create(1000, clock).getDimension()).isEqualTo(256);
        }

        @Test
        @DisplayName("should bind hash and proof to the timestamp")
        void bindHashAndProof() {
            StateContainer container = StateContainer.create(4, clock);

            String expectedHash = Fingerprints.fingerprint(
                    Fingerprints.canonical(container.getAmplitudes()), container.getTimestamp());
            assertThat(container.getStateHash()).isEqualTo(expectedHash);
            assertThat(container.getProof()).isEqualTo(Fingerprints.fingerprint(expectedHash, container.getTimestamp()));
            assertThat(container.getTimestamp()).isEqualTo(clock.millis());
        }

        @Test
        @DisplayName("should reset a zero vector to the first basis state")
        void resetZeroVector() {
            StateContainer container = StateContainer.fromAmplitudes(
                    List.of(Amplitude.ZERO, Amplitude.of(1e-14, 0), Amplitude.ZERO), clock);

            assertThat(container.getAmplitudes())
                    .containsExactly(Amplitude.of(1, 0), Amplitude.ZERO, Amplitude.ZERO);
        }

        @Test
        @DisplayName("should reject caller-supplied amplitudes outside the dimension range")
        void rejectInvalidDimension() {
            assertThatThrownBy(() -> StateContainer.fromAmplitudes(List.of(Amplitude.of(1, 0)), clock))
                    .isInstanceOf(ValidationException.class)
                    .extracting("reason").isEqualTo(ValidationException.Reason.INVALID_DIMENSION);
        }
    }

    @Nested
    @DisplayName("Evolution")
    class EvolutionTests {

        @Test
        @DisplayName("identity evolution should keep magnitudes and change the hash")
        void identityEvolutionChangesHashOnly() {
            StateContainer container = StateContainer.create(4, clock);
            List<Amplitude> before = container.getAmplitudes();
            String hashBefore = container.getStateHash();

            container.evolve(identity(4));

            for (int i = 0; i < 4; i++) {
                assertThat(container.getAmplitudes().get(i).magnitude())
                        .isCloseTo(before.get(i).magnitude(), within(1e-12));
            }
            assertThat(container.getStateHash()).isNotEqualTo(hashBefore);
            assertThat(container.verify()).isTrue();
        }

        @Test
        @DisplayName("should advance the timestamp even within the same millisecond")
        void strictlyIncreasingTimestamp() {
            StateContainer container = StateContainer.create(2, clock);
            long first = container.getTimestamp();

            container.evolve(identity(2));
            container.evolve(identity(2));

            assertThat(container.getTimestamp()).isEqualTo(first + 2);
        }

        @Test
        @DisplayName("should apply the matrix-vector product and renormalize")
        void applyProductAndRenormalize() {
            StateContainer container = StateContainer.fromAmplitudes(
                    List.of(Amplitude.of(1, 0), Amplitude.ZERO), clock);
            double h = 1 / Math.sqrt(2);
            Amplitude[][] hadamard = {
                    {Amplitude.of(h, 0), Amplitude.of(h, 0)},
                    {Amplitude.of(h, 0), Amplitude.of(-h, 0)}
            };

            clock.advanceSeconds(1);
            container.evolve(hadamard);

            assertThat(container.getAmplitudes().get(0).getReal()).isCloseTo(h, within(1e-12));
            assertThat(container.getAmplitudes().get(1).getReal()).isCloseTo(h, within(1e-12));
            assertThat(Math.abs(totalProbability(container) - 1.0)).isLessThan(1e-9);
        }

        @Test
        @DisplayName("should multiply complex entries")
        void multiplyComplexEntries() {
            StateContainer container = StateContainer.fromAmplitudes(
                    List.of(Amplitude.of(1, 0), Amplitude.ZERO), clock);
            Amplitude[][] phase = {
                    {Amplitude.of(0, 1), Amplitude.ZERO},
                    {Amplitude.ZERO, Amplitude.of(1, 0)}
            };

            container.evolve(phase);

            assertThat(container.getAmplitudes().get(0).getReal()).isCloseTo(0.0, within(1e-12));
            assertThat(container.getAmplitudes().get(0).getImaginary()).isCloseTo(1.0, within(1e-12));
        }

        @Test
        @DisplayName("should stay normalized across repeated random evolutions")
        void stayNormalized() {
            StateContainer container = StateContainer.create(8, clock);
            for (int round = 0; round < 20; round++) {
                Amplitude[][] matrix = new Amplitude[8][8];
                for (int row = 0; row < 8; row++) {
                    for (int col = 0; col < 8; col++) {
                        matrix[row][col] = Amplitude.of(Math.sin(round + row * col), Math.cos(row - col + round));
                    }
                }
                container.evolve(matrix);
                assertThat(Math.abs(totalProbability(container) - 1.0)).isLessThan(1e-9);
            }
        }

        @Test
        @DisplayName("should reject a matrix of the wrong shape")
        void rejectWrongShape() {
            StateContainer container = StateContainer.create(3, clock);
            String hashBefore = container.getStateHash();

            assertThatThrownBy(() -> container.evolve(identity(2)))
                    .isInstanceOf(ValidationException.class)
                    .extracting("reason").isEqualTo(ValidationException.Reason.DIMENSION_MISMATCH);

            Amplitude[][] ragged = identity(3);
            ragged[1] = new Amplitude[]{Amplitude.of(1, 0)};
            assertThatThrownBy(() -> container.evolve(ragged))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> container.evolve(null))
                    .isInstanceOf(ValidationException.class);

            assertThat(container.getStateHash()).isEqualTo(hashBefore);
        }
    }

    @Nested
    @DisplayName("Measurement")
    class MeasurementTests {

        @Test
        @DisplayName("uniform two-dimensional state should split close to 50/50")
        void uniformSplit() {
            StateContainer container = StateContainer.fromAmplitudes(
                    List.of(Amplitude.of(1, 0), Amplitude.of(1, 0)), clock);

            int zeros = 0;
            for (int i = 0; i < 10_000; i++) {
                if (container.measure(0).getOutcome() == 0) {
                    zeros++;
                }
            }

            assertThat(zeros).isBetween(4700, 5300);
        }

        @Test
        @DisplayName("basis state should always measure its own index")
        void basisStateIsCertain() {
            StateContainer container = StateContainer.fromAmplitudes(
                    List.of(Amplitude.ZERO, Amplitude.ZERO, Amplitude.of(0, 1)), clock);

            for (int i = 0; i < 100; i++) {
                MeasurementResult result = container.measure(i % 3);
                assertThat(result.getOutcome()).isEqualTo(2);
                assertThat(result.getProbability()).isCloseTo(1.0, within(1e-12));
                assertThat(result.getProof()).hasSize(64);
            }
        }

        @Test
        @DisplayName("should not collapse the stored state")
        void readOnly() {
            StateContainer container = StateContainer.create(4, clock);
            StateRecord before = container.toRecord();

            container.measure(1);

            assertThat(container.toRecord()).isEqualTo(before);
        }

        @ParameterizedTest
        @ValueSource(ints = {-1, 4, 100})
        @DisplayName("should reject a basis index outside the dimension")
        void rejectInvalidBasis(int basisIndex) {
            StateContainer container = StateContainer.create(4, clock);

            assertThatThrownBy(() -> container.measure(basisIndex))
                    .isInstanceOf(ValidationException.class)
                    .extracting("reason").isEqualTo(ValidationException.Reason.INVALID_BASIS);
        }
    }

    @Nested
    @DisplayName("Records and integrity")
    class RecordTests {

        @Test
        @DisplayName("reconstructed record should verify")
        void roundTripVerifies() {
            StateContainer container = StateContainer.create(16, clock);
            container.evolve(identity(16));

            StateContainer restored = StateContainer.fromRecord(container.toRecord(), clock);

            assertThat(restored.verify()).isTrue();
            assertThat(restored.getStateHash()).isEqualTo(container.getStateHash());
            assertThat(restored.getAmplitudes()).isEqualTo(container.getAmplitudes());
        }

        @Test
        @DisplayName("should raise IntegrityException for tampered amplitudes")
        void detectTamperedAmplitudes() {
            StateRecord record = StateContainer.create(2, clock).toRecord();
            List<Amplitude> swapped = new ArrayList<>(record.getAmplitudes());
            swapped.set(0, record.getAmplitudes().get(1));
            swapped.set(1, record.getAmplitudes().get(0));
            record.setAmplitudes(swapped);

            assertThatThrownBy(() -> StateContainer.fromRecord(record, clock))
                    .isInstanceOf(IntegrityException.class);
        }

        @Test
        @DisplayName("should raise IntegrityException for a shifted timestamp")
        void detectTamperedTimestamp() {
            StateRecord record = StateContainer.create(2, clock).toRecord();
            record.setTimestamp(record.getTimestamp() + 1);

            assertThatThrownBy(() -> StateContainer.fromRecord(record, clock))
                    .isInstanceOf(IntegrityException.class);
        }

        @Test
        @DisplayName("should raise ValidationException for malformed records")
        void rejectMalformed() {
            StateRecord valid = StateContainer.create(3, clock).toRecord();

            StateRecord wrongDimension = valid.toBuilder().dimension(4).build();
            StateRecord missingHash = valid.toBuilder().stateHash(null).build();
            StateRecord outOfRange = valid.toBuilder().dimension(1).build();

            assertThatThrownBy(() -> StateContainer.fromRecord(wrongDimension, clock))
                    .isInstanceOf(ValidationException.class)
                    .extracting("reason").isEqualTo(ValidationException.Reason.MALFORMED_RECORD);
            assertThatThrownBy(() -> StateContainer.fromRecord(missingHash, clock))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> StateContainer.fromRecord(outOfRange, clock))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> StateContainer.fromRecord(null, clock))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Correlation")
    class CorrelationTests {

        @Test
        @DisplayName("state correlated with itself should be 1")
        void selfCorrelation() {
            StateContainer container = StateContainer.create(8, clock);

            CorrelationResult result = container.correlate(container);

            assertThat(result.getCorrelation()).isCloseTo(1.0, within(1e-9));
            assertThat(result.getProof()).isEqualTo(Fingerprints.fingerprint(
                    container.getStateHash(), container.getStateHash(), result.getCorrelation()));
        }

        @Test
        @DisplayName("should treat indices beyond the shorter state as zero")
        void zeroPadShorterState() {
            StateContainer shorter = StateContainer.fromAmplitudes(
                    List.of(Amplitude.of(1, 0), Amplitude.ZERO), clock);
            StateContainer longer = StateContainer.fromAmplitudes(
                    List.of(Amplitude.of(1, 0), Amplitude.ZERO, Amplitude.of(1, 0)), clock);

            double h = 1 / Math.sqrt(2);
            assertThat(shorter.correlate(longer).getCorrelation()).isCloseTo(h, within(1e-12));
            assertThat(longer.correlate(shorter).getCorrelation()).isCloseTo(h, within(1e-12));
        }

        @Test
        @DisplayName("orthogonal states should not correlate")
        void orthogonalStates() {
            StateContainer first = StateContainer.fromAmplitudes(List.of(Amplitude.of(1, 0), Amplitude.ZERO), clock);
            StateContainer second = StateContainer.fromAmplitudes(List.of(Amplitude.ZERO, Amplitude.of(1, 0)), clock);

            assertThat(first.correlate(second).getCorrelation()).isZero();
        }
    }
}
