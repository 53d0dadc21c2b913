package product.domain;

import java.util.Locale;

// Lookups and inserts must both normalize through here.
public final class Sku {

  private Sku() {
  }

  public static String normalize(String raw) {
    if (raw == null)
      return null;
    return raw.strip().toUpperCase(Locale.ROOT);
  }
}
