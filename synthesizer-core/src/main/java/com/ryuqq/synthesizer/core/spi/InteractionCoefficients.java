package com.ryuqq.synthesizer.core.spi;

/**
 * Non-local part of a KAK factorization: exp(i·(x·XX + y·YY + z·ZZ)).
 *
 * @param x XX coefficient (radians)
 * @param y YY coefficient (radians)
 * @param z ZZ coefficient (radians)
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public record InteractionCoefficients(double x, double y, double z) {
}
