package hintvote.coordinator.control;

/**
 * Terms of one controller update, kept for telemetry.
 *
 * @param errorSum mean error over the proportional window, in 100us units
 * @param pOut     proportional contribution
 * @param iOut     integral contribution
 * @param dOut     derivative contribution
 */
public record PidTerms(long errorSum, long pOut, long iOut, long dOut) {

    public static final PidTerms ZERO = new PidTerms(0, 0, 0, 0);

    public long output() {
        return pOut + iOut + dOut;
    }
}
