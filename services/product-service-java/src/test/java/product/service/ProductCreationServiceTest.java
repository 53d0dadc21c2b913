package product.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import product.config.ProductServiceProperties;
import product.domain.InventoryHistoryEntry;
import product.domain.InventoryRecord;
import product.domain.Product;
import product.domain.Warehouse;
import product.repository.InventoryHistoryRepository;
import product.repository.InventoryRepository;
import product.repository.ProductRepository;
import product.repository.WarehouseRepository;
import product.service.error.ConflictException;
import product.service.error.ErrorKind;
import product.service.error.InternalErrorException;
import product.service.error.NotFoundException;
import product.service.error.Reason;
import product.service.error.ValidationException;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ProductCreationServiceTest {

    ProductRepository products;
    InventoryRepository inventory;
    WarehouseRepository warehouses;
    InventoryHistoryRepository history;
    PlatformTransactionManager txManager;
    ProductCreationService service;

    @BeforeEach
    void setUp() {
        products = mock(ProductRepository.class);
        inventory = mock(InventoryRepository.class);
        warehouses = mock(WarehouseRepository.class);
        history = mock(InventoryHistoryRepository.class);
        txManager = mock(PlatformTransactionManager.class);
        when(txManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());

        service = new ProductCreationService(products, inventory, warehouses, history, txManager,
                new ProductServiceProperties());

        when(products.findBySku(anyString())).thenReturn(Optional.empty());
        when(warehouses.findById(1L)).thenReturn(Optional.of(new Warehouse(1L, 1L, "Main", "Dock 1")));
        when(products.insert(any(Product.class))).thenReturn(42L);
    }

    private static Map<String, Object> widget() {
        var body = new HashMap<String, Object>();
        body.put("name", "  Widget ");
        body.put("sku", "  w-100 ");
        body.put("price", "19.99");
        body.put("warehouseId", 1);
        body.put("initialQuantity", 50);
        return body;
    }

    @Test
    void createProduct_insertsProductInventoryAndHistory_thenCommits() {
        var created = service.createProduct(widget());

        assertThat(created.getProductId()).isEqualTo(42L);

        var productCaptor = ArgumentCaptor.forClass(Product.class);
        verify(products).insert(productCaptor.capture());
        assertThat(productCaptor.getValue().getName()).isEqualTo("Widget");
        assertThat(productCaptor.getValue().getSku()).isEqualTo("W-100");
        assertThat(productCaptor.getValue().getPrice()).isEqualByComparingTo(new BigDecimal("19.99"));
        assertThat(productCaptor.getValue().getDescription()).isEqualTo("");

        var inventoryCaptor = ArgumentCaptor.forClass(InventoryRecord.class);
        verify(inventory).insert(inventoryCaptor.capture());
        assertThat(inventoryCaptor.getValue().getProductId()).isEqualTo(42L);
        assertThat(inventoryCaptor.getValue().getWarehouseId()).isEqualTo(1L);
        assertThat(inventoryCaptor.getValue().getQuantity()).isEqualTo(50);

        var historyCaptor = ArgumentCaptor.forClass(InventoryHistoryEntry.class);
        verify(history).insert(historyCaptor.capture());
        assertThat(historyCaptor.getValue().getChangeType()).isEqualTo(InventoryHistoryEntry.ChangeType.IN);
        assertThat(historyCaptor.getValue().getQuantityAfter()).isEqualTo(50);
        assertThat(historyCaptor.getValue().getReferenceId()).isEqualTo(42L);

        verify(txManager).commit(any());
        verify(txManager, never()).rollback(any());
    }

    @Test
    void createProduct_looksUpSkuInNormalizedForm() {
        service.createProduct(widget());

        verify(products).findBySku("W-100");
    }

    @Test
    void createProduct_existingSku_conflictsBeforeAnyWrite() {
        when(products.findBySku("W-100")).thenReturn(Optional.of(new Product()));

        assertThatThrownBy(() -> service.createProduct(widget()))
                .isInstanceOf(ConflictException.class)
                .extracting("reason").isEqualTo(Reason.SKU_EXISTS);

        verify(products, never()).insert(any());
        verifyNoInteractions(inventory, history, txManager);
    }

    @Test
    void createProduct_missingWarehouse_isNotFound() {
        var body = widget();
        body.put("warehouseId", 7);

        assertThatThrownBy(() -> service.createProduct(body))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Warehouse not found");

        verify(products, never()).insert(any());
        verifyNoInteractions(txManager);
    }

    @Test
    void createProduct_warehouseIdAsNumericString_isResolved() {
        var body = widget();
        body.put("warehouseId", "1");

        service.createProduct(body);

        verify(warehouses).findById(1L);
    }

    @Test
    void createProduct_nonNumericWarehouseId_isNotFoundWithoutLookup() {
        var body = widget();
        body.put("warehouseId", "main");

        assertThatThrownBy(() -> service.createProduct(body))
                .isInstanceOf(NotFoundException.class);

        verify(warehouses, never()).findById(anyLong());
    }

    @Test
    void createProduct_validationRunsBeforeSkuLookup() {
        var body = widget();
        body.put("price", "-1");

        assertThatThrownBy(() -> service.createProduct(body))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Price cannot be negative");

        verifyNoInteractions(products, warehouses, txManager);
    }

    @Test
    void createProduct_duplicateKeyOnInsert_rollsBackAndReportsIntegrityViolation() {
        when(products.insert(any(Product.class))).thenThrow(new DuplicateKeyException("uq_products_sku"));

        assertThatThrownBy(() -> service.createProduct(widget()))
                .isInstanceOf(ConflictException.class)
                .extracting("reason").isEqualTo(Reason.INTEGRITY_VIOLATION);

        verify(txManager).rollback(any());
        verify(txManager, never()).commit(any());
        verifyNoInteractions(inventory);
    }

    @Test
    void createProduct_inventoryInsertFails_rollsBackProductInsert() {
        doThrow(new IllegalStateException("disk full")).when(inventory).insert(any());

        assertThatThrownBy(() -> service.createProduct(widget()))
                .isInstanceOf(InternalErrorException.class)
                .hasMessage("disk full")
                .extracting("kind").isEqualTo(ErrorKind.INTERNAL);

        verify(products).insert(any());
        verify(txManager).rollback(any());
        verify(txManager, never()).commit(any());
        verifyNoInteractions(history);
    }

    @Test
    void createProduct_constraintViolationAtCommit_isIntegrityViolation() {
        doThrow(new DataIntegrityViolationException("fk_inventory_warehouse")).when(txManager).commit(any());

        assertThatThrownBy(() -> service.createProduct(widget()))
                .isInstanceOf(ConflictException.class)
                .extracting("reason").isEqualTo(Reason.INTEGRITY_VIOLATION);
    }

    @Test
    void createProduct_negativeQuantityAllowedWhenCheckDisabled() {
        var props = new ProductServiceProperties();
        props.getInventory().setRejectNegativeQuantity(false);
        service = new ProductCreationService(products, inventory, warehouses, history, txManager, props);
        var body = widget();
        body.put("initialQuantity", -3);

        service.createProduct(body);

        var inventoryCaptor = ArgumentCaptor.forClass(InventoryRecord.class);
        verify(inventory).insert(inventoryCaptor.capture());
        assertThat(inventoryCaptor.getValue().getQuantity()).isEqualTo(-3);
    }

    @Test
    void createProduct_skuLookupFails_isInternalErrorWithoutTransaction() {
        when(products.findBySku(anyString())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> service.createProduct(widget()))
                .isInstanceOf(InternalErrorException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);

        verifyNoInteractions(txManager);
    }

    @Test
    void createProduct_warehouseLookupFails_isInternalError() {
        when(warehouses.findById(1L)).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> service.createProduct(widget()))
                .isInstanceOf(InternalErrorException.class)
                .extracting("kind").isEqualTo(ErrorKind.INTERNAL);

        verify(products, never()).insert(any());
    }

    @Test
    void createProduct_typedFailuresPassThroughUnchanged() {
        var body = widget();
        body.remove("sku");

        assertThatThrownBy(() -> service.createProduct(body))
                .isExactlyInstanceOf(ValidationException.class)
                .hasMessage("Missing fields: sku");
    }
}
