package org.mides.routeplanner.service;

import org.mides.routeplanner.model.Order;
import org.mides.routeplanner.model.OrderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Orders waiting for the next planning pass, keyed and ordered by id.
 */
@Component
public class UnscheduledOrderPool {

    private static final Logger logger = LoggerFactory.getLogger(UnscheduledOrderPool.class);

    private final ConcurrentSkipListMap<String, Order> orders = new ConcurrentSkipListMap<>();

    public void add(Order order) {
        order.setStatus(OrderStatus.PENDING);
        order.setRouteId(null);
        order.setRouteSequence(null);
        orders.put(order.getId(), order);
        logger.debug("Order {} returned to the unscheduled pool", order.getId());
    }

    public void addAll(Collection<Order> returned) {
        returned.forEach(this::add);
    }

    public boolean remove(String orderId) {
        return orders.remove(orderId) != null;
    }

    /* Takes every pooled order out, in id order */
    public List<Order> drain() {
        var drained = new ArrayList<Order>();
        Map.Entry<String, Order> next;
        while ((next = orders.pollFirstEntry()) != null) {
            drained.add(next.getValue());
        }
        return drained;
    }

    public List<Order> snapshot() {
        return new ArrayList<>(orders.values());
    }

    public int size() {
        return orders.size();
    }
}
