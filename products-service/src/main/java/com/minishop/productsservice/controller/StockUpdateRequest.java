package com.minishop.productsservice.controller;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

// PATCH /products/{id}/stock, body {"quantity": 0}. Absolute value, not a delta.
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StockUpdateRequest {
  private Integer quantity;
}
