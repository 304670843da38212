package com.minishop.productsservice.repository;

import com.minishop.productsservice.model.Product;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * In-memory product catalog. Records are kept in insertion order and handed out as copies, so a
 * caller has to re-fetch to observe later changes. IDs come from a counter that only moves forward,
 * which means an ID is never reused after a delete.
 *
 * <p>Every method locks the repository instance; the servlet container dispatches requests on
 * parallel threads and this is the only shared state in the process.
 */
@Repository
public class ProductRepository {

  private final Clock clock;
  private final Map<Long, Product> products = new LinkedHashMap<>();
  private long nextId;

  @Autowired
  public ProductRepository(Clock clock) {
    this.clock = clock;
    for (Product product : seedProducts()) {
      products.put(product.getId(), product);
    }
    this.nextId = products.keySet().stream().mapToLong(Long::longValue).max().orElse(0L) + 1;
  }

  public synchronized List<Product> findAll() {
    List<Product> all = new ArrayList<>(products.size());
    for (Product product : products.values()) {
      all.add(product.copy());
    }
    return all;
  }

  public synchronized Optional<Product> findById(Long id) {
    return Optional.ofNullable(products.get(id)).map(Product::copy);
  }

  public synchronized Product save(Product product) {
    Product stored = product.copy();
    stored.setId(nextId++);
    stored.setCreatedAt(Instant.now(clock));
    stored.setUpdatedAt(null);
    products.put(stored.getId(), stored);
    return stored.copy();
  }

  /** Applies {@code changes} to the stored record and stamps {@code updatedAt}. */
  public synchronized Optional<Product> update(Long id, Consumer<Product> changes) {
    Product stored = products.get(id);
    if (stored == null) {
      return Optional.empty();
    }
    changes.accept(stored);
    stored.setUpdatedAt(Instant.now(clock));
    return Optional.of(stored.copy());
  }

  public synchronized Optional<Product> deleteById(Long id) {
    return Optional.ofNullable(products.remove(id));
  }

  public synchronized int count() {
    return products.size();
  }

  private static List<Product> seedProducts() {
    List<Product> seed = new ArrayList<>();
    seed.add(
        seedProduct(
            1L,
            "Laptop Pro X1",
            "High-performance laptop for professionals",
            "1299.99",
            "Electronics",
            45,
            "2024-01-10"));
    seed.add(
        seedProduct(
            2L,
            "Wireless Mouse",
            "Ergonomic wireless mouse with precision tracking",
            "29.99",
            "Accessories",
            150,
            "2024-01-15"));
    seed.add(
        seedProduct(
            3L,
            "USB-C Hub",
            "7-in-1 USB-C hub with HDMI, USB 3.0, and card reader",
            "49.99",
            "Accessories",
            80,
            "2024-02-01"));
    seed.add(
        seedProduct(
            4L,
            "Mechanical Keyboard",
            "RGB mechanical gaming keyboard with Cherry MX switches",
            "159.99",
            "Accessories",
            60,
            "2024-02-05"));
    seed.add(
        seedProduct(
            5L,
            "4K Monitor",
            "27-inch 4K IPS monitor with HDR support",
            "399.99",
            "Electronics",
            25,
            "2024-02-10"));
    return seed;
  }

  private static Product seedProduct(
      Long id,
      String name,
      String description,
      String price,
      String category,
      int stock,
      String createdOn) {
    return Product.builder()
        .id(id)
        .name(name)
        .description(description)
        .price(new BigDecimal(price))
        .category(category)
        .stock(stock)
        .createdAt(Instant.parse(createdOn + "T00:00:00Z"))
        .build();
  }
}
