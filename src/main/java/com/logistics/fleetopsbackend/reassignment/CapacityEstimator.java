package com.logistics.fleetopsbackend.reassignment;

import com.logistics.fleetopsbackend.dto.ImpactReport.CapacityImpact;
import com.logistics.fleetopsbackend.model.Order;
import com.logistics.fleetopsbackend.model.RouteStop;
import com.logistics.fleetopsbackend.model.Vehicle;
import com.logistics.fleetopsbackend.repository.OrderRepository;
import com.logistics.fleetopsbackend.repository.VehicleRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Load of a driver's open stops against the combined capacity of the vehicles
 * involved: the vehicles of the moved stops plus those of the driver's own open
 * stops. Utilization is the larger of the weight and volume ratios, in percent.
 */
@Component
@RequiredArgsConstructor
public class CapacityEstimator {

    private final OrderRepository orderRepository;
    private final VehicleRepository vehicleRepository;

    public CapacityImpact estimate(String companyId, List<RouteStop> driverOpenStops, List<RouteStop> movedStops) {
        return estimate(companyId, driverOpenStops, movedStops, loadOrders(companyId, driverOpenStops, movedStops));
    }

    public CapacityImpact estimate(String companyId, List<RouteStop> driverOpenStops, List<RouteStop> movedStops,
                                   Map<String, Order> ordersById) {
        Set<String> vehicleIds = Stream.concat(driverOpenStops.stream(), movedStops.stream())
                .map(RouteStop::getVehicleId)
                .filter(id -> id != null)
                .collect(Collectors.toSet());

        double weightCapacity = 0.0;
        double volumeCapacity = 0.0;
        for (Vehicle vehicle : vehicleRepository.findByCompanyIdAndIdIn(companyId, vehicleIds)) {
            weightCapacity += vehicle.getWeightCapacity();
            volumeCapacity += vehicle.getVolumeCapacity();
        }

        Load current = Load.of(driverOpenStops, ordersById);
        Load projected = current.plus(Load.of(movedStops, ordersById));

        long currentPct = utilization(current, weightCapacity, volumeCapacity);
        long projectedPct = utilization(projected, weightCapacity, volumeCapacity);
        return new CapacityImpact(currentPct, projectedPct, Math.max(0, 100 - projectedPct));
    }

    public Map<String, Order> loadOrders(String companyId, Collection<RouteStop> first, Collection<RouteStop> second) {
        Set<String> orderIds = new HashSet<>();
        Stream.concat(first.stream(), second.stream())
                .map(RouteStop::getOrderId)
                .filter(id -> id != null)
                .forEach(orderIds::add);
        if (orderIds.isEmpty()) {
            return Map.of();
        }
        return orderRepository.findByCompanyIdAndIdIn(companyId, orderIds).stream()
                .collect(Collectors.toMap(Order::getId, Function.identity(), (a, b) -> a));
    }

    // Capacity of 0 on one axis means that axis is not constrained
    private static long utilization(Load load, double weightCapacity, double volumeCapacity) {
        double weightRatio = weightCapacity > 0 ? load.weight / weightCapacity : 0.0;
        double volumeRatio = volumeCapacity > 0 ? load.volume / volumeCapacity : 0.0;
        return Math.round(Math.max(weightRatio, volumeRatio) * 100);
    }

    private static final class Load {
        private final double weight;
        private final double volume;

        private Load(double weight, double volume) {
            this.weight = weight;
            this.volume = volume;
        }

        static Load of(List<RouteStop> stops, Map<String, Order> ordersById) {
            double weight = 0.0;
            double volume = 0.0;
            for (RouteStop stop : stops) {
                Order order = stop.getOrderId() != null ? ordersById.get(stop.getOrderId()) : null;
                if (order != null) {
                    weight += order.weightOrZero();
                    volume += order.volumeOrZero();
                }
            }
            return new Load(weight, volume);
        }

        Load plus(Load other) {
            return new Load(weight + other.weight, volume + other.volume);
        }
    }
}
