package com.minishop.productsservice.error;

import lombok.Getter;

@Getter
public class ProductNotFoundException extends RuntimeException {

  private final Object productId;

  public ProductNotFoundException(Object productId) {
    super("Product not found with id: " + productId);
    this.productId = productId;
  }
}
