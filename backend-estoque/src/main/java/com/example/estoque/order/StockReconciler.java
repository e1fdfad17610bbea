package com.example.estoque.order;

import com.example.estoque.common.InsufficientStockException;
import com.example.estoque.common.NotFoundException;
import com.example.estoque.common.ValidationException;
import com.example.estoque.product.Product;
import com.example.estoque.product.ProductRepository;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Movimentação de estoque causada pelos pedidos. Deve rodar dentro da
 * transação aberta por {@link OrderService}: os produtos são lidos com lock
 * de escrita e as alterações só ficam visíveis no commit.
 *
 * <p>O fluxo é sempre planejar e depois aplicar: {@link #plan} valida todas as
 * linhas (existência e estoque) sem alterar nada, e só então
 * {@link #checkout} decrementa o estoque e grava os itens.
 */
@Component
@RequiredArgsConstructor
class StockReconciler {

    private static final Logger log = LoggerFactory.getLogger(StockReconciler.class);

    private final ProductRepository productRepository;
    private final OrderItemRepository orderItemRepository;

    /**
     * Regras de forma da lista de itens, checadas antes de qualquer leitura.
     */
    static void validateItens(List<OrderRequest.Item> itens) {
        if (itens == null || itens.isEmpty()) {
            throw new ValidationException("Pedido deve conter pelo menos um item");
        }
        Set<Long> vistos = new HashSet<>();
        for (OrderRequest.Item item : itens) {
            if (item == null || item.getProdutoId() == null) {
                throw new ValidationException("Item inválido");
            }
            if (!vistos.add(item.getProdutoId())) {
                throw new ValidationException("Não é possível ter produtos duplicados no mesmo pedido");
            }
        }
        for (OrderRequest.Item item : itens) {
            if (item.getQuantidade() == null || item.getQuantidade() <= 0) {
                throw new ValidationException("Quantidade deve ser maior que zero");
            }
        }
    }

    /**
     * Valida todas as linhas, na ordem recebida, contra o estoque atual.
     * Nenhuma alteração é feita aqui.
     */
    List<PlannedLine> plan(List<OrderRequest.Item> itens) {
        validateItens(itens);
        List<PlannedLine> plano = new ArrayList<>(itens.size());
        for (OrderRequest.Item item : itens) {
            Product produto = productRepository.findByIdForUpdate(item.getProdutoId())
                    .orElseThrow(() -> new NotFoundException("Produto " + item.getProdutoId() + " não encontrado"));
            if (produto.getQuantidadeEstoque() < item.getQuantidade()) {
                throw new InsufficientStockException(produto.getId(), produto.getNome(),
                        produto.getQuantidadeEstoque(), item.getQuantidade());
            }
            plano.add(new PlannedLine(produto, item.getQuantidade()));
        }
        return plano;
    }

    static double total(List<PlannedLine> plano) {
        double total = 0.0;
        for (PlannedLine linha : plano) {
            total += linha.getValorTotalItem();
        }
        return total;
    }

    /**
     * Baixa o estoque e grava um item por linha do plano, com snapshot do
     * nome e do preço atuais do produto.
     */
    List<OrderItem> checkout(Long pedidoId, List<PlannedLine> plano) {
        List<OrderItem> itens = new ArrayList<>(plano.size());
        for (PlannedLine linha : plano) {
            Product produto = linha.getProduto();
            produto.setQuantidadeEstoque(produto.getQuantidadeEstoque() - linha.getQuantidade());
            log.debug("Estoque do produto {}: -{} -> {}", produto.getId(), linha.getQuantidade(),
                    produto.getQuantidadeEstoque());

            itens.add(OrderItem.builder()
                    .pedidoId(pedidoId)
                    .produtoId(produto.getId())
                    .nomeProduto(produto.getNome())
                    .quantidade(linha.getQuantidade())
                    .precoUnitario(produto.getPreco())
                    .valorTotalItem(linha.getValorTotalItem())
                    .build());
        }
        productRepository.saveAll(plano.stream().map(PlannedLine::getProduto).toList());
        return orderItemRepository.saveAll(itens);
    }

    /**
     * Devolve ao estoque as quantidades dos itens e remove os itens.
     */
    void reverse(List<OrderItem> itens) {
        for (OrderItem item : itens) {
            // FK com RESTRICT: produto referenciado por item sempre existe
            Product produto = productRepository.findByIdForUpdate(item.getProdutoId())
                    .orElseThrow(() -> new IllegalStateException(
                            "Produto " + item.getProdutoId() + " referenciado pelo item " + item.getId() + " não existe"));
            produto.setQuantidadeEstoque(produto.getQuantidadeEstoque() + item.getQuantidade());
            log.debug("Estoque do produto {}: +{} -> {}", produto.getId(), item.getQuantidade(),
                    produto.getQuantidadeEstoque());
        }
        orderItemRepository.deleteAll(itens);
        // remove antes de inserir os novos itens (uk_item_pedido_produto)
        orderItemRepository.flush();
    }

    @Getter
    @RequiredArgsConstructor
    static final class PlannedLine {
        private final Product produto;
        private final int quantidade;

        double getValorTotalItem() {
            return quantidade * produto.getPreco();
        }
    }
}
