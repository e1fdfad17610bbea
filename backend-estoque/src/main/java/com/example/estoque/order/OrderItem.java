package com.example.estoque.order;

import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Linha do pedido. Guarda só as chaves do pedido e do produto, mais o
 * snapshot de nome e preço no momento da venda; nenhuma coluna é atualizável.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "itens_pedido")
public class OrderItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "pedido_id", nullable = false, updatable = false)
    private Long pedidoId;

    @Column(name = "produto_id", nullable = false, updatable = false)
    private Long produtoId;

    @Column(name = "nome_produto", nullable = false, updatable = false, length = 100)
    private String nomeProduto;

    @Column(name = "quantidade", nullable = false, updatable = false)
    private Integer quantidade;

    @Column(name = "preco_unitario", nullable = false, updatable = false)
    private Double precoUnitario;

    @Column(name = "valor_total_item", nullable = false, updatable = false)
    private Double valorTotalItem;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    void onCreate() {
        createdAt = OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }
}
