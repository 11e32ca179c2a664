package io.chainindex.core.node;

import io.chainindex.core.protocol.HashX;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static io.chainindex.core.TestChain.hashX;
import static org.junit.jupiter.api.Assertions.*;

class NotificationsTest {

    private record Fired(int height, Set<HashX> touched) {}

    private final List<Fired> fired = new ArrayList<>();
    private final Notifications notifications = new Notifications();

    @Test
    void blocksWaitForTheMempoolAtTheirHeight() {
        notifications.start(5, (height, touched) -> fired.add(new Fired(height, Set.copyOf(touched))));
        assertEquals(List.of(new Fired(5, Set.of())), fired);

        notifications.onBlock(Set.of(hashX(1)), 6);
        notifications.onMempool(Set.of(hashX(2)), 5);
        assertEquals(1, fired.size());

        notifications.onMempool(Set.of(hashX(3)), 6);
        assertEquals(new Fired(6, Set.of(hashX(1), hashX(3))), fired.get(1));
    }

    @Test
    void mempoolRefreshesAtTheTipFireAlone() {
        notifications.start(3, (height, touched) -> fired.add(new Fired(height, Set.copyOf(touched))));
        notifications.onMempool(Set.of(hashX(4)), 3);
        notifications.onMempool(Set.of(), 3);
        assertEquals(List.of(new Fired(3, Set.of()), new Fired(3, Set.of(hashX(4))), new Fired(3, Set.of())), fired);
    }

    @Test
    void blocksAheadOfTheMempoolAreMerged() {
        notifications.start(1, (height, touched) -> fired.add(new Fired(height, Set.copyOf(touched))));
        notifications.onBlock(Set.of(hashX(1)), 2);
        notifications.onBlock(Set.of(hashX(2)), 3);
        notifications.onMempool(Set.of(), 3);
        assertEquals(new Fired(3, Set.of(hashX(1), hashX(2))), fired.get(fired.size() - 1));
        assertEquals(2, fired.size());
    }

    @Test
    void failingListenersDoNotBreakDelivery() {
        notifications.start(0, (height, touched) -> {
            throw new IllegalStateException("boom");
        });
        assertDoesNotThrow(() -> notifications.onMempool(Set.of(hashX(1)), 0));
    }
}
