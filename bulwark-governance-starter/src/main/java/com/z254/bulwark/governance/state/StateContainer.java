package com.z254.bulwark.governance.state;

import com.z254.bulwark.governance.error.IntegrityException;
import com.z254.bulwark.governance.error.ValidationException;
import com.z254.bulwark.governance.error.ValidationException.Reason;
import lombok.extern.slf4j.Slf4j;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Normalized vector of complex amplitudes with a recomputable integrity fingerprint.
 * <p>
 * A container has exactly one logical owner. {@link #evolve(Amplitude[][])} replaces the
 * state in place and is not safe to call concurrently on the same instance; reads
 * ({@link #measure(int)}, {@link #verify()}, {@link #toRecord()}) always observe a
 * consistent snapshot and may run concurrently with each other.
 */
@Slf4j
public class StateContainer {

    public static final int MIN_DIMENSION = 2;
    public static final int MAX_DIMENSION = 256;
    public static final double NORMALIZATION_TOLERANCE = 1e-9;

    static final double ZERO_NORM_THRESHOLD = 1e-12;

    private static final SecureRandom ENTROPY = new SecureRandom();

    private final int dimension;
    private final Clock clock;
    private final byte[] measurementKey;
    private final AtomicLong measurementSequence = new AtomicLong();

    private volatile Snapshot snapshot;

    private StateContainer(int dimension, Clock clock) {
        this.dimension = dimension;
        this.clock = clock;
        this.measurementKey = Fingerprints.newKey(ENTROPY);
    }

    // === Construction ===

    public static StateContainer create(int dimension) {
        return create(dimension, Clock.systemUTC());
    }

    /**
     * Random state of the given dimension, clamped to [2, 256].
     */
    public static StateContainer create(int dimension, Clock clock) {
        int clamped = Math.max(MIN_DIMENSION, Math.min(MAX_DIMENSION, dimension));
        List<Amplitude> drawn = new ArrayList<>(clamped);
        for (int i = 0; i < clamped; i++) {
            drawn.add(Amplitude.of(ENTROPY.nextDouble() * 2 - 1, ENTROPY.nextDouble() * 2 - 1));
        }
        StateContainer container = new StateContainer(clamped, clock);
        container.replace(normalize(drawn), Long.MIN_VALUE);
        return container;
    }

    /**
     * State built from caller-supplied coordinates, normalized on entry.
     */
    public static StateContainer fromAmplitudes(List<Amplitude> amplitudes, Clock clock) {
        if (amplitudes == null || amplitudes.size() < MIN_DIMENSION || amplitudes.size() > MAX_DIMENSION) {
            throw new ValidationException(Reason.INVALID_DIMENSION,
                    "dimension must be within [" + MIN_DIMENSION + ", " + MAX_DIMENSION + "]");
        }
        StateContainer container = new StateContainer(amplitudes.size(), clock);
        container.replace(normalize(amplitudes), Long.MIN_VALUE);
        return container;
    }

    public static StateContainer fromRecord(StateRecord record) {
        return fromRecord(record, Clock.systemUTC());
    }

    /**
     * Rebuilds a container and verifies its fingerprints.
     *
     * @throws ValidationException if the record is structurally invalid
     * @throws IntegrityException  if the fingerprints do not match the content
     */
    public static StateContainer fromRecord(StateRecord record, Clock clock) {
        if (record == null) {
            throw new ValidationException(Reason.MALFORMED_RECORD, "record is null");
        }
        int dimension = record.getDimension();
        if (dimension < MIN_DIMENSION || dimension > MAX_DIMENSION) {
            throw new ValidationException(Reason.MALFORMED_RECORD, "dimension " + dimension + " out of range");
        }
        List<Amplitude> amplitudes = record.getAmplitudes();
        if (amplitudes == null || amplitudes.size() != dimension) {
            throw new ValidationException(Reason.MALFORMED_RECORD, "expected " + dimension + " amplitudes");
        }
        for (Amplitude a : amplitudes) {
            if (a == null || !Double.isFinite(a.getReal()) || !Double.isFinite(a.getImaginary())) {
                throw new ValidationException(Reason.MALFORMED_RECORD, "amplitudes must be finite");
            }
        }
        if (record.getStateHash() == null || record.getProof() == null) {
            throw new ValidationException(Reason.MALFORMED_RECORD, "stateHash and proof are required");
        }

        StateContainer container = new StateContainer(dimension, clock);
        container.snapshot = new Snapshot(
                Collections.unmodifiableList(new ArrayList<>(amplitudes)),
                record.getStateHash(), record.getProof(), record.getTimestamp());

        if (!container.verify()) {
            throw new IntegrityException("State fingerprint mismatch at timestamp " + record.getTimestamp());
        }
        double total = totalProbability(amplitudes);
        if (Math.abs(total - 1.0) > NORMALIZATION_TOLERANCE) {
            throw new ValidationException(Reason.MALFORMED_RECORD, "state is not normalized: " + total);
        }
        return container;
    }

    // === Operations ===

    /**
     * Applies {@code matrix · amplitudes}, renormalizes and recomputes the fingerprints.
     */
    public void evolve(Amplitude[][] matrix) {
        if (matrix == null || matrix.length != dimension) {
            throw new ValidationException(Reason.DIMENSION_MISMATCH,
                    "matrix must be " + dimension + "x" + dimension);
        }
        for (Amplitude[] row : matrix) {
            if (row == null || row.length != dimension) {
                throw new ValidationException(Reason.DIMENSION_MISMATCH,
                        "matrix must be " + dimension + "x" + dimension);
            }
        }

        Snapshot current = snapshot;
        List<Amplitude> product = new ArrayList<>(dimension);
        for (int row = 0; row < dimension; row++) {
            Amplitude sum = Amplitude.ZERO;
            for (int col = 0; col < dimension; col++) {
                Amplitude entry = matrix[row][col] != null ? matrix[row][col] : Amplitude.ZERO;
                sum = sum.plus(entry.times(current.amplitudes.get(col)));
            }
            product.add(sum);
        }
        replace(normalize(product), current.timestamp);
        log.debug("State evolved: dimension={}, hash={}", dimension, snapshot.stateHash);
    }

    /**
     * Draws an outcome from the |amplitude|² distribution without collapsing the state.
     */
    public MeasurementResult measure(int basisIndex) {
        if (basisIndex < 0 || basisIndex >= dimension) {
            throw new ValidationException(Reason.INVALID_BASIS,
                    "basis index " + basisIndex + " outside [0, " + dimension + ")");
        }
        Snapshot current = snapshot;
        long now = clock.millis();
        double draw = Fingerprints.keyedUniform(measurementKey,
                current.stateHash, basisIndex, now, measurementSequence.incrementAndGet());

        int outcome = dimension - 1;
        double cumulative = 0.0;
        for (int i = 0; i < dimension; i++) {
            cumulative += current.amplitudes.get(i).probability();
            if (draw < cumulative) {
                outcome = i;
                break;
            }
        }

        return MeasurementResult.builder()
                .outcome(outcome)
                .probability(current.amplitudes.get(outcome).probability())
                .proof(Fingerprints.fingerprint(current.stateHash, basisIndex, outcome, now))
                .build();
    }

    /**
     * Recomputes hash and proof from the current fields and compares them.
     */
    public boolean verify() {
        Snapshot current = snapshot;
        String expectedHash = Fingerprints.fingerprint(Fingerprints.canonical(current.amplitudes), current.timestamp);
        String expectedProof = Fingerprints.fingerprint(expectedHash, current.timestamp);
        return expectedHash.equals(current.stateHash) && expectedProof.equals(current.proof);
    }

    /**
     * Real part of the inner product over the shared prefix of both states.
     * Coordinates beyond the shorter state count as zero.
     */
    public CorrelationResult correlate(StateContainer other) {
        Snapshot mine = snapshot;
        Snapshot theirs = other.snapshot;
        int shared = Math.min(mine.amplitudes.size(), theirs.amplitudes.size());
        double correlation = 0.0;
        for (int i = 0; i < shared; i++) {
            Amplitude a = mine.amplitudes.get(i);
            Amplitude b = theirs.amplitudes.get(i);
            correlation += a.getReal() * b.getReal() + a.getImaginary() * b.getImaginary();
        }
        return CorrelationResult.builder()
                .correlation(correlation)
                .proof(Fingerprints.fingerprint(mine.stateHash, theirs.stateHash, correlation))
                .build();
    }

    public StateRecord toRecord() {
        Snapshot current = snapshot;
        return StateRecord.builder()
                .dimension(dimension)
                .amplitudes(new ArrayList<>(current.amplitudes))
                .stateHash(current.stateHash)
                .proof(current.proof)
                .timestamp(current.timestamp)
                .build();
    }

    // === Accessors ===

    public int getDimension() {
        return dimension;
    }

    public List<Amplitude> getAmplitudes() {
        return snapshot.amplitudes;
    }

    public String getStateHash() {
        return snapshot.stateHash;
    }

    public String getProof() {
        return snapshot.proof;
    }

    public long getTimestamp() {
        return snapshot.timestamp;
    }

    // === Internals ===

    /**
     * Divides by the Euclidean norm; a near-zero vector resets to the first basis state.
     */
    static List<Amplitude> normalize(List<Amplitude> amplitudes) {
        double norm = Math.sqrt(totalProbability(amplitudes));
        List<Amplitude> normalized = new ArrayList<>(amplitudes.size());
        if (norm < ZERO_NORM_THRESHOLD || !Double.isFinite(norm)) {
            normalized.add(Amplitude.of(1.0, 0.0));
            for (int i = 1; i < amplitudes.size(); i++) {
                normalized.add(Amplitude.ZERO);
            }
            return normalized;
        }
        for (Amplitude a : amplitudes) {
            normalized.add(a.dividedBy(norm));
        }
        return normalized;
    }

    private static double totalProbability(List<Amplitude> amplitudes) {
        double total = 0.0;
        for (Amplitude a : amplitudes) {
            total += a.probability();
        }
        return total;
    }

    // Timestamps strictly increase so every replacement yields a new hash.
    private void replace(List<Amplitude> amplitudes, long previousTimestamp) {
        long now = clock.millis();
        long timestamp = previousTimestamp == Long.MIN_VALUE ? now : Math.max(now, previousTimestamp + 1);
        String stateHash = Fingerprints.fingerprint(Fingerprints.canonical(amplitudes), timestamp);
        String proof = Fingerprints.fingerprint(stateHash, timestamp);
        this.snapshot = new Snapshot(Collections.unmodifiableList(amplitudes), stateHash, proof, timestamp);
    }

    private static final class Snapshot {
        private final List<Amplitude> amplitudes;
        private final String stateHash;
        private final String proof;
        private final long timestamp;

        private Snapshot(List<Amplitude> amplitudes, String stateHash, String proof, long timestamp) {
            this.amplitudes = amplitudes;
            this.stateHash = stateHash;
            this.proof = proof;
            this.timestamp = timestamp;
        }
    }
}
