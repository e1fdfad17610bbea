package com.example.estoque.order;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface OrderItemRepository extends JpaRepository<OrderItem, Long> {

    List<OrderItem> findByPedidoIdOrderByIdAsc(Long pedidoId);

    List<OrderItem> findByPedidoIdInOrderByIdAsc(Collection<Long> pedidoIds);

    boolean existsByProdutoId(Long produtoId);
}
