package com.minishop.productsservice.service;

import com.minishop.productsservice.dto.CategorySummary;
import com.minishop.productsservice.dto.ProductRequest;
import com.minishop.productsservice.dto.ProductStats;
import com.minishop.productsservice.error.ProductNotFoundException;
import com.minishop.productsservice.error.ValidationException;
import com.minishop.productsservice.model.Product;
import com.minishop.productsservice.repository.ProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ProductServiceTest {

  private ProductRepository productRepository;
  private ProductService productService;

  @BeforeEach
  void setup() {
    productRepository = new ProductRepository(Clock.systemUTC());
    productService = new ProductService(productRepository);
  }

  @Test
  void getProducts_shouldApplyInclusivePriceBounds() {
    List<Product> products =
        productService.getProducts(null, new BigDecimal("100"), new BigDecimal("200"), null);

    assertThat(products).extracting(Product::getName).containsExactly("Mechanical Keyboard");
    assertThat(products)
        .allSatisfy(
            p -> assertThat(p.getPrice()).isBetween(new BigDecimal("100"), new BigDecimal("200")));
  }

  @Test
  void getProducts_shouldCombineCategoryAndPriceFilters() {
    List<Product> products =
        productService.getProducts(
            "accessories", new BigDecimal("29.99"), new BigDecimal("49.99"), null);

    assertThat(products)
        .extracting(Product::getName)
        .containsExactly("Wireless Mouse", "USB-C Hub");
  }

  @Test
  void getProducts_shouldTruncateAfterFiltering() {
    List<Product> products = productService.getProducts("Accessories", null, null, 2);

    assertThat(products).extracting(Product::getId).containsExactly(2L, 3L);
  }

  @Test
  void searchProducts_shouldMatchNameDescriptionOrCategoryIgnoringCase() {
    assertThat(productService.searchProducts("LAPTOP"))
        .extracting(Product::getId)
        .containsExactly(1L);
    assertThat(productService.searchProducts("hdmi"))
        .extracting(Product::getId)
        .containsExactly(3L);
    assertThat(productService.searchProducts("electronics"))
        .extracting(Product::getId)
        .containsExactly(1L, 5L);
  }

  @Test
  void searchProducts_shouldRejectMissingQuery() {
    assertThatThrownBy(() -> productService.searchProducts(""))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Search query is required");
  }

  @Test
  void searchProducts_shouldRejectWhitespaceQuery() {
    assertThatThrownBy(() -> productService.searchProducts("   "))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Search query is required");
  }

  @Test
  void getCategories_shouldSummariseInFirstAppearanceOrder() {
    List<CategorySummary> categories = productService.getCategories();

    assertThat(categories)
        .containsExactly(
            new CategorySummary("Electronics", 2, "849.99"),
            new CategorySummary("Accessories", 3, "79.99"));
  }

  @Test
  void createProduct_shouldApplyDefaults() {
    Product created =
        productService.createProduct(
            ProductRequest.builder()
                .name("Webcam")
                .price(new BigDecimal("59.50"))
                .category("Electronics")
                .build());

    assertThat(created.getId()).isEqualTo(6L);
    assertThat(created.getDescription()).isEmpty();
    assertThat(created.getStock()).isZero();
  }

  @Test
  void createProduct_shouldRejectNonPositivePriceWithoutCreatingRecord() {
    ProductRequest request =
        ProductRequest.builder().name("Freebie").price(BigDecimal.ZERO).category("Promo").build();

    assertThatThrownBy(() -> productService.createProduct(request))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Price must be greater than 0");
    assertThat(productRepository.count()).isEqualTo(5);
  }

  @Test
  void createProduct_shouldRejectMissingCategory() {
    ProductRequest request =
        ProductRequest.builder().name("Webcam").price(new BigDecimal("10")).build();

    assertThatThrownBy(() -> productService.createProduct(request))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Name, price, and category are required");
  }

  @Test
  void updateProduct_shouldTreatEmptyDescriptionAndZeroStockAsRealUpdates() {
    Product updated =
        productService.updateProduct(
            4L, ProductRequest.builder().description("").stock(0).build());

    assertThat(updated.getDescription()).isEmpty();
    assertThat(updated.getStock()).isZero();
    assertThat(updated.getName()).isEqualTo("Mechanical Keyboard");
    assertThat(updated.getPrice()).isEqualByComparingTo("159.99");
    assertThat(updated.getUpdatedAt()).isNotNull();
  }

  @Test
  void updateProduct_shouldRejectNonPositivePrice() {
    ProductRequest request = ProductRequest.builder().price(new BigDecimal("-1")).build();

    assertThatThrownBy(() -> productService.updateProduct(1L, request))
        .isInstanceOf(ValidationException.class);
    assertThat(productRepository.findById(1L).orElseThrow().getPrice())
        .isEqualByComparingTo("1299.99");
  }

  @Test
  void updateProduct_shouldReportMissingProductBeforeValidating() {
    ProductRequest request = ProductRequest.builder().price(BigDecimal.ZERO).build();

    assertThatThrownBy(() -> productService.updateProduct(42L, request))
        .isInstanceOf(ProductNotFoundException.class);
  }

  @Test
  void updateStock_shouldSetAbsoluteQuantity() {
    assertThat(productService.updateStock(2L, 0).getStock()).isZero();
    assertThat(productService.updateStock(2L, 7).getStock()).isEqualTo(7);
  }

  @Test
  void updateStock_shouldRequireQuantity() {
    assertThatThrownBy(() -> productService.updateStock(2L, null))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Quantity is required");
  }

  @Test
  void getStats_shouldAggregateSeedCatalog() {
    ProductStats stats = productService.getStats();

    assertThat(stats.getTotal()).isEqualTo(5);
    assertThat(stats.getTotalStock()).isEqualTo(360);
    assertThat(stats.getTotalValue()).isEqualTo("86596.40");
    assertThat(stats.getAveragePrice()).isEqualTo("387.99");
    assertThat(stats.getByCategory())
        .containsEntry("Electronics", 2L)
        .containsEntry("Accessories", 3L);
  }

  @Test
  void getStats_shouldReportZeroAverageForEmptyCatalog() {
    for (long id = 1; id <= 5; id++) {
      productService.deleteProduct(id);
    }

    ProductStats stats = productService.getStats();

    assertThat(stats.getTotal()).isZero();
    assertThat(stats.getAveragePrice()).isEqualTo("0.00");
    assertThat(stats.getTotalValue()).isEqualTo("0.00");
  }
}
