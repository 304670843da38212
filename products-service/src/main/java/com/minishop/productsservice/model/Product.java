package com.minishop.productsservice.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Product {

  private Long id;

  private String name;

  private String description;

  private BigDecimal price;

  private String category;

  private Integer stock;

  private Instant createdAt;

  // Absent until the first successful mutation
  @JsonInclude(JsonInclude.Include.NON_NULL)
  private Instant updatedAt;

  public Product copy() {
    return toBuilder().build();
  }
}
