package org.circuitrepl.hardware;

/**
 * Source of randomness for the hardware simulation. Seeded implementations make simulated
 * sensor drift reproducible in tests.
 */
public interface IRandomProvider {

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Creates a derived provider that is deterministically based on this provider and the given scope.
     *
     * @param scope a stable, descriptive scope name (e.g., "sensor")
     * @param key a stable numeric key
     * @return a derived random provider
     */
    IRandomProvider deriveFor(String scope, long key);
}
