package product.repository;

import java.util.Optional;

import product.domain.Warehouse;

public interface WarehouseRepository {
    Optional<Warehouse> findById(long id);
}
