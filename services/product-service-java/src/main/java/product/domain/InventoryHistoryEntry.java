package product.domain;

public class InventoryHistoryEntry {

  public enum ChangeType {
    IN, OUT, ADJUSTMENT, TRANSFER
  }

  public static final String REFERENCE_PRODUCT_CREATION = "PRODUCT_CREATION";

  private long warehouseId;
  private long productId;
  private ChangeType changeType;
  private int quantityBefore;
  private int quantityChange;
  private int quantityAfter;
  private String referenceType;
  private Long referenceId;
  private String notes;

  public static InventoryHistoryEntry initialStock(InventoryRecord record) {
    var e = new InventoryHistoryEntry();
    e.warehouseId = record.getWarehouseId();
    e.productId = record.getProductId();
    e.changeType = ChangeType.IN;
    e.quantityBefore = 0;
    e.quantityChange = record.getQuantity();
    e.quantityAfter = record.getQuantity();
    e.referenceType = REFERENCE_PRODUCT_CREATION;
    e.referenceId = record.getProductId();
    e.notes = "Initial stock";
    return e;
  }

  public long getWarehouseId() {
    return warehouseId;
  }

  public long getProductId() {
    return productId;
  }

  public ChangeType getChangeType() {
    return changeType;
  }

  public int getQuantityBefore() {
    return quantityBefore;
  }

  public int getQuantityChange() {
    return quantityChange;
  }

  public int getQuantityAfter() {
    return quantityAfter;
  }

  public String getReferenceType() {
    return referenceType;
  }

  public Long getReferenceId() {
    return referenceId;
  }

  public String getNotes() {
    return notes;
  }

  public void setWarehouseId(long warehouseId) {
    this.warehouseId = warehouseId;
  }

  public void setProductId(long productId) {
    this.productId = productId;
  }

  public void setChangeType(ChangeType changeType) {
    this.changeType = changeType;
  }

  public void setQuantityBefore(int quantityBefore) {
    this.quantityBefore = quantityBefore;
  }

  public void setQuantityChange(int quantityChange) {
    this.quantityChange = quantityChange;
  }

  public void setQuantityAfter(int quantityAfter) {
    this.quantityAfter = quantityAfter;
  }

  public void setReferenceType(String referenceType) {
    this.referenceType = referenceType;
  }

  public void setReferenceId(Long referenceId) {
    this.referenceId = referenceId;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }
}
