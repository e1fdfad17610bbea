package com.example.estoque;

import com.example.estoque.order.CustomerOrderRepository;
import com.example.estoque.order.OrderItemRepository;
import com.example.estoque.product.ProductRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class EstoquePedidosApplicationTest {

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private CustomerOrderRepository orderRepository;

    @Autowired
    private OrderItemRepository orderItemRepository;

    @Test
    void contextLoads() {
        assertThat(productRepository).isNotNull();
        assertThat(orderRepository).isNotNull();
        assertThat(orderItemRepository).isNotNull();
    }
}
