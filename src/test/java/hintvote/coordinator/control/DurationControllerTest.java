package hintvote.coordinator.control;

import hintvote.coordinator.config.ControlProfile;
import hintvote.coordinator.model.WorkDuration;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DurationControllerTest {

    private static final long MS = 1_000_000L;
    private static final long TARGET = 10 * MS;

    private static ControlProfile plainPid() {
        return ControlProfile.builder().heuristicBoostOn(false).build();
    }

    private static List<WorkDuration> single(long durationNanos) {
        return List.of(new WorkDuration(durationNanos, durationNanos));
    }

    private static List<WorkDuration> batch(int count, long durationNanos) {
        List<WorkDuration> result = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            result.add(new WorkDuration(i * 16 * MS, durationNanos));
        }
        return result;
    }

    @Test
    void pidOffReturnsHighBound() {
        DurationController controller = new DurationController(
                ControlProfile.builder().pidOn(false).build());

        assertEquals(480, controller.update(single(12 * MS), TARGET, 162));
        assertNull(new DurationController(plainPid()).history());
    }

    @Test
    void emptyBatchIsRejected() {
        DurationController controller = new DurationController(plainPid());

        assertThrows(IllegalArgumentException.class, () -> controller.update(List.of(), TARGET, 162));
    }

    @Test
    void overTargetRaisesFloor() {
        DurationController controller = new DurationController(plainPid());

        // error 20: P 2.0 * 20, D 500 * 20 / dt 100
        assertEquals(302, controller.update(single(12 * MS), TARGET, 162));
        assertEquals(new PidTerms(20, 40, 0, 100), controller.lastTerms());
        assertEquals(20, controller.previousError());

        // steady error, no derivative
        assertEquals(342, controller.update(single(12 * MS), TARGET, 302));
        assertEquals(0, controller.lastTerms().dOut());
    }

    @Test
    void underTargetLowersFloorWithoutDerivative() {
        DurationController controller = new DurationController(plainPid());

        assertEquals(142, controller.update(single(8 * MS), TARGET, 162));
        assertEquals(-20, controller.lastTerms().pOut());
        assertEquals(0, controller.lastTerms().dOut());
    }

    @Test
    void outputIsClampedToBounds() {
        DurationController controller = new DurationController(plainPid());

        assertEquals(2, controller.update(single(MS), TARGET, 5));
        assertEquals(480, controller.update(single(50 * MS), TARGET, 470));
    }

    @Test
    void pTermUsesTrailingWindowOnly() {
        DurationController controller = new DurationController(plainPid());
        List<WorkDuration> durations = List.of(
                new WorkDuration(16 * MS, 30 * MS),
                new WorkDuration(32 * MS, 11 * MS));

        PidTerms terms = controller.computeTerms(durations, TARGET);

        assertEquals(10, terms.errorSum());
        assertEquals(20, terms.pOut());
    }

    @Test
    void integralIsClamped() {
        ControlProfile profile = ControlProfile.builder()
                .heuristicBoostOn(false)
                .pidI(0.1)
                .build();
        assertEquals(5120, profile.pidIHighDivI());
        assertEquals(-300, profile.pidILowDivI());

        DurationController controller = new DurationController(profile);
        assertEquals(2000, controller.integralError());

        controller.update(single(100 * MS), MS, 162);
        assertEquals(5120, controller.integralError());

        controller.update(single(0), TARGET, 162);
        assertEquals(-300, controller.integralError());
    }

    @Test
    void hugeTargetSaturatesIntegralAtItsBounds() {
        ControlProfile profile = ControlProfile.builder()
                .heuristicBoostOn(false)
                .pidI(0.1)
                .build();
        DurationController controller = new DurationController(profile);
        long target = Long.MAX_VALUE / 2;

        controller.update(single(Long.MAX_VALUE), target, 162);
        assertEquals(5120, controller.integralError());

        controller.update(single(0), target, 162);
        assertEquals(-300, controller.integralError());
    }

    @Test
    void missedCyclesTurnHeuristicBoostOn() {
        ControlProfile profile = ControlProfile.builder().maxRecordsNum(10).build();
        DurationController controller = new DurationController(profile);

        int next = controller.update(batch(8, 20 * MS), TARGET, 700);

        assertTrue(controller.heuristicBoostActive());
        assertEquals(722, next);
        assertEquals(8, controller.history().missedCycles());
    }

    @Test
    void boostTurnsOffOnceHistoryRecovers() {
        ControlProfile profile = ControlProfile.builder().maxRecordsNum(10).build();
        DurationController controller = new DurationController(profile);
        controller.update(batch(8, 20 * MS), TARGET, 700);
        assertTrue(controller.heuristicBoostActive());

        controller.update(batch(10, 5 * MS), TARGET, 700);

        assertFalse(controller.heuristicBoostActive());
        assertEquals(0, controller.history().missedCycles());
    }

    @Test
    void boostStaysOffWithoutHistory() {
        DurationController controller = new DurationController(plainPid());

        int next = controller.update(batch(8, 20 * MS), TARGET, 700);

        assertFalse(controller.heuristicBoostActive());
        assertEquals(480, next);
    }
}
