package com.example.estoque.order;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Getter;

import java.time.OffsetDateTime;
import java.util.List;

@Getter
@Builder
public class OrderResponse {
    @JsonProperty("id")
    private final Long id;

    @JsonProperty("cliente")
    private final String cliente;

    @JsonProperty("valor_total")
    private final Double valorTotal;

    @JsonProperty("data_pedido")
    private final OffsetDateTime dataPedido;

    @JsonProperty("itens")
    private final List<Item> itens;

    static OrderResponse of(CustomerOrder pedido, List<OrderItem> itens) {
        return OrderResponse.builder()
                .id(pedido.getId())
                .cliente(pedido.getCliente())
                .valorTotal(pedido.getValorTotal())
                .dataPedido(pedido.getDataPedido())
                .itens(itens.stream().map(Item::of).toList())
                .build();
    }

    @Getter
    @Builder
    public static class Item {
        @JsonProperty("id")
        private final Long id;

        @JsonProperty("produto_id")
        private final Long produtoId;

        @JsonProperty("nome_produto")
        private final String nomeProduto;

        @JsonProperty("quantidade")
        private final Integer quantidade;

        @JsonProperty("preco_unitario")
        private final Double precoUnitario;

        @JsonProperty("valor_total_item")
        private final Double valorTotalItem;

        static Item of(OrderItem item) {
            return Item.builder()
                    .id(item.getId())
                    .produtoId(item.getProdutoId())
                    .nomeProduto(item.getNomeProduto())
                    .quantidade(item.getQuantidade())
                    .precoUnitario(item.getPrecoUnitario())
                    .valorTotalItem(item.getValorTotalItem())
                    .build();
        }
    }
}
