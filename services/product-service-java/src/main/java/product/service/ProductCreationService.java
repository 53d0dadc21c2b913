package product.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import product.config.ProductServiceProperties;
import product.domain.InventoryHistoryEntry;
import product.domain.InventoryRecord;
import product.domain.ProductDraft;
import product.repository.InventoryHistoryRepository;
import product.repository.InventoryRepository;
import product.repository.ProductRepository;
import product.repository.WarehouseRepository;
import product.service.error.ConflictException;
import product.service.error.InternalErrorException;
import product.service.error.NotFoundException;
import product.service.error.ProductCreationException;
import product.service.error.Reason;

import java.util.Map;

/**
 * Creates a product together with its inventory row in the originating warehouse.
 *
 * <p>The SKU and warehouse lookups happen before the transaction and are advisory only. Two
 * concurrent requests can both pass them; the unique and foreign key constraints decide at
 * write time and the loser gets {@link Reason#INTEGRITY_VIOLATION}.
 */
@Service
public class ProductCreationService {

    private static final Logger log = LoggerFactory.getLogger(ProductCreationService.class);

    private final ProductRepository products;
    private final InventoryRepository inventory;
    private final WarehouseRepository warehouses;
    private final InventoryHistoryRepository history;
    private final PlatformTransactionManager transactionManager;
    private final ProductServiceProperties properties;

    public ProductCreationService(
            ProductRepository products,
            InventoryRepository inventory,
            WarehouseRepository warehouses,
            InventoryHistoryRepository history,
            PlatformTransactionManager transactionManager,
            ProductServiceProperties properties) {
        this.products = products;
        this.inventory = inventory;
        this.warehouses = warehouses;
        this.history = history;
        this.transactionManager = transactionManager;
        this.properties = properties;
    }

    public CreatedProduct createProduct(Map<String, Object> raw) {
        try {
            return create(raw);
        } catch (ProductCreationException e) {
            throw e;
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException(Reason.INTEGRITY_VIOLATION, e);
        } catch (RuntimeException e) {
            throw new InternalErrorException(e);
        }
    }

    private CreatedProduct create(Map<String, Object> raw) {
        ProductDraft draft = ProductDraftParser.parse(raw, properties.getInventory().isRejectNegativeQuantity());

        if (products.findBySku(draft.getSku()).isPresent())
            throw new ConflictException(Reason.SKU_EXISTS);

        long warehouseId = ProductDraftParser.parseWarehouseId(draft.getWarehouseId())
                .filter(id -> warehouses.findById(id).isPresent())
                .orElseThrow(() -> new NotFoundException(Reason.WAREHOUSE_NOT_FOUND));

        long productId = insertAll(draft, warehouseId);

        log.info("Created product {} (sku={}) with {} units in warehouse {}",
                productId, draft.getSku(), draft.getInitialQuantity(), warehouseId);
        return new CreatedProduct(productId);
    }

    /**
     * Runs the inserts in one transaction. Any exception rolls it back before leaving
     * {@link TransactionTemplate#execute}.
     */
    private long insertAll(ProductDraft draft, long warehouseId) {
        var tx = new TransactionTemplate(transactionManager);
        Long id = tx.execute(status -> {
            long productId = products.insert(draft.toProduct());

            var record = new InventoryRecord(productId, warehouseId, draft.getInitialQuantity());
            inventory.insert(record);
            history.insert(InventoryHistoryEntry.initialStock(record));
            return productId;
        });
        if (id == null)
            throw new IllegalStateException("transaction returned no product id");
        return id;
    }
}
