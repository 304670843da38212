package com.minishop.productsservice.repository;

import com.minishop.productsservice.model.Product;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ProductRepositoryTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private ProductRepository productRepository;

  @BeforeEach
  void setup() {
    productRepository = new ProductRepository(Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void shouldLoadSeedCatalogInInsertionOrder() {
    List<Product> products = productRepository.findAll();

    assertThat(products).extracting(Product::getId).containsExactly(1L, 2L, 3L, 4L, 5L);
    assertThat(products.get(0).getName()).isEqualTo("Laptop Pro X1");
    assertThat(products).allSatisfy(p -> assertThat(p.getUpdatedAt()).isNull());
  }

  @Test
  void save_shouldAssignNextIdAfterSeedAndStampCreatedAt() {
    Product created = productRepository.save(newProduct("Desk Lamp"));

    assertThat(created.getId()).isEqualTo(6L);
    assertThat(created.getCreatedAt()).isEqualTo(NOW);
    assertThat(created.getUpdatedAt()).isNull();
    assertThat(productRepository.count()).isEqualTo(6);
  }

  @Test
  void save_shouldNeverReuseIdOfDeletedProduct() {
    Product first = productRepository.save(newProduct("Desk Lamp"));
    productRepository.deleteById(first.getId());

    Product second = productRepository.save(newProduct("Desk Mat"));

    assertThat(second.getId()).isGreaterThan(first.getId());
  }

  @Test
  void update_shouldApplyChangesAndStampUpdatedAt() {
    Product updated = productRepository.update(2L, p -> p.setStock(0)).orElseThrow();

    assertThat(updated.getStock()).isZero();
    assertThat(updated.getName()).isEqualTo("Wireless Mouse");
    assertThat(updated.getUpdatedAt()).isEqualTo(NOW);
  }

  @Test
  void update_shouldReturnEmpty_whenProductMissing() {
    assertThat(productRepository.update(99L, p -> p.setStock(1))).isEmpty();
  }

  @Test
  void findById_shouldHandOutCopies() {
    Product fetched = productRepository.findById(1L).orElseThrow();
    fetched.setName("Changed outside the store");

    assertThat(productRepository.findById(1L).orElseThrow().getName()).isEqualTo("Laptop Pro X1");
  }

  @Test
  void deleteById_shouldReturnRemovedProduct() {
    assertThat(productRepository.deleteById(5L))
        .get()
        .extracting(Product::getName)
        .isEqualTo("4K Monitor");
    assertThat(productRepository.findById(5L)).isEmpty();
    assertThat(productRepository.deleteById(5L)).isEmpty();
  }

  private Product newProduct(String name) {
    return Product.builder()
        .name(name)
        .description("")
        .price(new BigDecimal("19.99"))
        .category("Office")
        .stock(3)
        .build();
  }
}
