package org.mides.routeplanner.service;

import org.junit.jupiter.api.Test;
import org.mides.routeplanner.model.Coordinate;
import org.mides.routeplanner.model.Order;
import org.mides.routeplanner.model.OrderStatus;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UnscheduledOrderPoolTest {

    @Test
    void add_shouldResetRouteMembership() {
        var pool = new UnscheduledOrderPool();
        var order = new Order("O1", new Coordinate(-34.9, -56.1));
        order.setStatus(OrderStatus.ASSIGNED);
        order.setRouteId("R-1");
        order.setRouteSequence(3);

        pool.add(order);

        assertEquals(OrderStatus.PENDING, order.getStatus());
        assertNull(order.getRouteId());
        assertNull(order.getRouteSequence());
    }

    @Test
    void drain_shouldEmptyPoolInIdOrder() {
        var pool = new UnscheduledOrderPool();
        pool.addAll(List.of(new Order("O3", null), new Order("O1", null), new Order("O2", null)));
        pool.add(new Order("O1", null));

        var drained = pool.drain();

        assertEquals(List.of("O1", "O2", "O3"), drained.stream().map(Order::getId).toList());
        assertEquals(0, pool.size());
        assertTrue(pool.drain().isEmpty());
    }
}
