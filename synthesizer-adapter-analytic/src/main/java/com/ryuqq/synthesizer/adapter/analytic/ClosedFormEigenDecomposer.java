package com.ryuqq.synthesizer.adapter.analytic;

import com.ryuqq.synthesizer.core.math.Complex;
import com.ryuqq.synthesizer.core.model.Unitary2;
import com.ryuqq.synthesizer.core.spi.EigenDecomposer;
import com.ryuqq.synthesizer.core.spi.EigenPairs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closed-form implementation of {@link EigenDecomposer} for 2x2 unitaries.
 *
 * <p>Eigenvalues come from the characteristic polynomial; no iteration is involved,
 * so results are exactly reproducible call-to-call.</p>
 *
 * <p><strong>Ordering Convention:</strong></p>
 * <pre>
 * m  = (a + d) / 2
 * s  = principal sqrt(((a − d) / 2)² + bc)     (Re(s) ≥ 0, equal to sqrt(m² − det))
 * λ0 = m + s
 * λ1 = m − s
 * </pre>
 *
 * <p><strong>Eigenvectors:</strong></p>
 * <ul>
 *   <li>v0 is the larger of the two row-derived candidates {@code (b, λ0 − a)} and
 *       {@code (λ0 − d, c)}, normalized</li>
 *   <li>v1 is the orthogonal complement {@code (−conj(v0[1]), conj(v0[0]))}, which is
 *       the λ1 eigenvector of any normal matrix and keeps the eigenvector matrix unitary</li>
 *   <li>When both candidates vanish the matrix is scalar and the computational basis is returned</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @author Synthesizer Team
 * @since 1.0.0
 */
public final class ClosedFormEigenDecomposer implements EigenDecomposer {

    private static final Logger log = LoggerFactory.getLogger(ClosedFormEigenDecomposer.class);

    /**
     * Candidate eigenvector norm below which the matrix is treated as scalar.
     */
    static final double DEGENERATE_THRESHOLD = 1e-14;

    @Override
    public EigenPairs decompose(Unitary2 mat) {
        if (mat == null) {
            throw new IllegalArgumentException("mat cannot be null");
        }
        Complex a = mat.get(0, 0);
        Complex b = mat.get(0, 1);
        Complex c = mat.get(1, 0);
        Complex d = mat.get(1, 1);

        Complex mid = a.add(d).scale(0.5);
        Complex halfGap = a.subtract(d).scale(0.5);
        // exactly zero for scalar matrices, unlike m² − det
        Complex s = halfGap.multiply(halfGap).add(b.multiply(c)).sqrt();
        Complex lambda0 = mid.add(s);
        Complex lambda1 = mid.subtract(s);

        Complex[] v0 = eigenvectorFor(lambda0, a, b, c, d);
        if (v0 == null) {
            log.debug("Scalar matrix, using computational basis as eigenvectors");
            return new EigenPairs(a, d, Unitary2.identity());
        }

        Complex[] v1 = {v0[1].conjugate().negate(), v0[0].conjugate()};
        Unitary2 eigenvectors = Unitary2.of(v0[0], v1[0], v0[1], v1[1]);
        return new EigenPairs(lambda0, lambda1, eigenvectors);
    }

    /**
     * Normalized eigenvector for the given eigenvalue.
     *
     * @return the normalized vector, or null when both candidates are near zero
     */
    private static Complex[] eigenvectorFor(Complex lambda, Complex a, Complex b, Complex c, Complex d) {
        // row 0: (λ − a)·x = b·y,  row 1: c·x = (λ − d)·y
        Complex[] fromRow0 = {b, lambda.subtract(a)};
        Complex[] fromRow1 = {lambda.subtract(d), c};

        double norm0 = norm(fromRow0);
        double norm1 = norm(fromRow1);
        Complex[] candidate = norm0 >= norm1 ? fromRow0 : fromRow1;
        double norm = Math.max(norm0, norm1);

        if (norm < DEGENERATE_THRESHOLD) {
            return null;
        }
        return new Complex[]{candidate[0].scale(1.0 / norm), candidate[1].scale(1.0 / norm)};
    }

    private static double norm(Complex[] vector) {
        return Math.sqrt(vector[0].absSquared() + vector[1].absSquared());
    }
}
