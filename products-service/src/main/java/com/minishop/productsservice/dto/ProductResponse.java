package com.minishop.productsservice.dto;

import com.minishop.productsservice.model.Product;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProductResponse {
  private String message;
  private Product product;
}
