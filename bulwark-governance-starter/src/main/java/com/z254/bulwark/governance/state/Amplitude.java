package com.z254.bulwark.governance.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * A single complex coordinate of a {@link StateContainer}.
 */
@Value
public class Amplitude {

    public static final Amplitude ZERO = new Amplitude(0.0, 0.0);

    double real;
    double imaginary;

    @JsonCreator
    public Amplitude(@JsonProperty("real") double real, @JsonProperty("imaginary") double imaginary) {
        this.real = real;
        this.imaginary = imaginary;
    }

    public static Amplitude of(double real, double imaginary) {
        return new Amplitude(real, imaginary);
    }

    public double magnitude() {
        return Math.sqrt(real * real + imaginary * imaginary);
    }

    /** Squared magnitude, the probability weight of this coordinate. */
    public double probability() {
        return real * real + imaginary * imaginary;
    }

    public Amplitude plus(Amplitude other) {
        return new Amplitude(real + other.real, imaginary + other.imaginary);
    }

    public Amplitude times(Amplitude other) {
        return new Amplitude(
                real * other.real - imaginary * other.imaginary,
                real * other.imaginary + imaginary * other.real);
    }

    public Amplitude dividedBy(double divisor) {
        return new Amplitude(real / divisor, imaginary / divisor);
    }
}
