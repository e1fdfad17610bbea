package com.example.estoque.order;

import com.example.estoque.common.ConflictException;
import com.example.estoque.common.InsufficientStockException;
import com.example.estoque.common.NotFoundException;
import com.example.estoque.common.ValidationException;
import com.example.estoque.product.Product;
import com.example.estoque.product.ProductRepository;
import com.example.estoque.product.ProductRequest;
import com.example.estoque.product.ProductService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@SpringBootTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class OrderServiceIntegrationTest {

    @Autowired
    private OrderService orderService;

    @Autowired
    private ProductService productService;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private CustomerOrderRepository orderRepository;

    @Autowired
    private OrderItemRepository orderItemRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setup() {
        jdbcTemplate.update("DELETE FROM itens_pedido");
        jdbcTemplate.update("DELETE FROM pedidos");
        jdbcTemplate.update("DELETE FROM produtos");
    }

    @Test
    void createDecrementsStockAndSnapshotsItems() {
        Product arroz = product("arroz", 2.5, 10);
        Product feijao = product("feijão", 4.25, 5);

        OrderResponse pedido = orderService.create(order("  joão da silva ",
                item(arroz, 3), item(feijao, 2)));

        assertThat(pedido.getId()).isNotNull();
        assertThat(pedido.getCliente()).isEqualTo("João Da Silva");
        assertThat(pedido.getValorTotal()).isEqualTo(16.0);
        assertThat(pedido.getDataPedido()).isNotNull();
        assertThat(pedido.getItens())
                .extracting(OrderResponse.Item::getProdutoId, OrderResponse.Item::getNomeProduto,
                        OrderResponse.Item::getQuantidade, OrderResponse.Item::getPrecoUnitario,
                        OrderResponse.Item::getValorTotalItem)
                .containsExactly(
                        tuple(arroz.getId(), "Arroz", 3, 2.5, 7.5),
                        tuple(feijao.getId(), "Feijão", 2, 4.25, 8.5));
        assertThat(stock(arroz)).isEqualTo(7);
        assertThat(stock(feijao)).isEqualTo(3);
    }

    @Test
    void totalEqualsSumOfItemTotals() {
        Product a = product("cafe", 13.9, 50);
        Product b = product("acucar", 4.79, 50);
        Product c = product("leite", 5.49, 50);

        OrderResponse pedido = orderService.create(order("Maria", item(a, 3), item(b, 7), item(c, 11)));

        double soma = 0.0;
        for (OrderResponse.Item it : pedido.getItens()) {
            assertThat(it.getValorTotalItem()).isEqualTo(it.getQuantidade() * it.getPrecoUnitario());
            soma += it.getValorTotalItem();
        }
        assertThat(pedido.getValorTotal()).isEqualTo(soma);
        assertThat(orderService.get(pedido.getId()).getValorTotal()).isEqualTo(soma);
    }

    @Test
    void readAfterCreateReturnsSameItems() {
        Product a = product("macarrao", 3.5, 10);
        Product b = product("molho", 2.0, 10);
        OrderResponse criado = orderService.create(order("Ana", item(a, 1), item(b, 4)));

        OrderResponse lido = orderService.get(criado.getId());

        assertThat(lido.getId()).isEqualTo(criado.getId());
        assertThat(lido.getCliente()).isEqualTo(criado.getCliente());
        assertThat(lido.getValorTotal()).isEqualTo(criado.getValorTotal());
        assertThat(lido.getItens()).usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(criado.getItens());
    }

    @Test
    void repeatedReadsWithoutMutationAreIdentical() {
        Product a = product("sal", 1.5, 10);
        orderService.create(order("Ana", item(a, 1)));
        orderService.create(order("Bia", item(a, 2)));

        List<OrderResponse> primeira = orderService.list(0, 100);
        List<OrderResponse> segunda = orderService.list(0, 100);
        assertThat(segunda).usingRecursiveComparison().isEqualTo(primeira);

        OrderResponse um = orderService.get(primeira.get(0).getId());
        OrderResponse dois = orderService.get(primeira.get(0).getId());
        assertThat(dois).usingRecursiveComparison().isEqualTo(um);
    }

    @Test
    void deleteRestoresStock() {
        Product a = product("oleo", 8.0, 20);
        OrderResponse pedido = orderService.create(order("Carlos", item(a, 6)));
        assertThat(stock(a)).isEqualTo(14);

        orderService.delete(pedido.getId());

        assertThat(stock(a)).isEqualTo(20);
        assertThat(orderRepository.existsById(pedido.getId())).isFalse();
        assertThat(orderItemRepository.findByPedidoIdOrderByIdAsc(pedido.getId())).isEmpty();
    }

    @Test
    void updateReversesOldItemsBeforeApplyingNewOnes() {
        Product p = product("farinha", 5.0, 10);
        OrderResponse pedido = orderService.create(order("Davi", item(p, 3)));
        assertThat(stock(p)).isEqualTo(7);

        OrderResponse atualizado = orderService.update(pedido.getId(), order("Davi", item(p, 5)));

        assertThat(stock(p)).isEqualTo(5);
        assertThat(atualizado.getId()).isEqualTo(pedido.getId());
        assertThat(atualizado.getValorTotal()).isEqualTo(25.0);
        assertThat(atualizado.getItens()).singleElement()
                .extracting(OrderResponse.Item::getQuantidade).isEqualTo(5);

        // só cabe se as 5 unidades do item antigo voltarem ao estoque antes da validação
        orderService.update(pedido.getId(), order("Davi", item(p, 10)));
        assertThat(stock(p)).isZero();
    }

    @Test
    void updateReplacesItemsCustomerAndTotal() {
        Product a = product("biscoito", 3.0, 10);
        Product b = product("suco", 6.5, 10);
        OrderResponse pedido = orderService.create(order("Eva", item(a, 2)));

        OrderResponse atualizado = orderService.update(pedido.getId(), order("eva maria", item(b, 2)));

        assertThat(atualizado.getCliente()).isEqualTo("Eva Maria");
        assertThat(atualizado.getValorTotal()).isEqualTo(13.0);
        assertThat(stock(a)).isEqualTo(10);
        assertThat(stock(b)).isEqualTo(8);
        assertThat(orderItemRepository.findByPedidoIdOrderByIdAsc(pedido.getId()))
                .extracting(OrderItem::getProdutoId).containsExactly(b.getId());
    }

    @Test
    void failedUpdateRollsBackReversalAndKeepsPreviousOrder() {
        Product p = product("cerveja", 4.0, 10);
        Product q = product("carvao", 20.0, 2);
        OrderResponse pedido = orderService.create(order("Fabio", item(p, 3)));

        assertThatThrownBy(() -> orderService.update(pedido.getId(),
                order("Outro Cliente", item(p, 5), item(q, 3))))
                .isInstanceOf(InsufficientStockException.class);

        assertThat(stock(p)).isEqualTo(7);
        assertThat(stock(q)).isEqualTo(2);
        OrderResponse lido = orderService.get(pedido.getId());
        assertThat(lido.getCliente()).isEqualTo("Fabio");
        assertThat(lido.getValorTotal()).isEqualTo(12.0);
        assertThat(lido.getItens()).usingRecursiveFieldByFieldElementComparator()
                .containsExactlyElementsOf(pedido.getItens());
    }

    @Test
    void updateMissingOrderFailsWithNotFound() {
        Product p = product("agua", 2.0, 10);

        assertThatThrownBy(() -> orderService.update(999_999L, order("Gil", item(p, 1))))
                .isInstanceOf(NotFoundException.class);
        assertThat(stock(p)).isEqualTo(10);
    }

    @Test
    void deleteMissingOrderFailsWithNotFound() {
        assertThatThrownBy(() -> orderService.delete(999_999L)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void duplicateProductLinesAreRejectedWithoutSideEffects() {
        Product p = product("pao", 0.5, 100);

        assertThatThrownBy(() -> orderService.create(order("Hugo", item(p, 1), item(p, 2))))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("duplicados");

        assertThat(stock(p)).isEqualTo(100);
        assertThat(orderRepository.count()).isZero();
    }

    @Test
    void nonPositiveQuantityIsRejected() {
        Product p = product("ovo", 0.75, 30);

        assertThatThrownBy(() -> orderService.create(order("Iris", item(p, 0))))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> orderService.create(order("Iris")))
                .isInstanceOf(ValidationException.class);
        assertThat(orderRepository.count()).isZero();
    }

    @Test
    void insufficientStockLeavesCatalogAndOrdersUnchanged() {
        Product a = product("queijo", 30.0, 10);
        Product b = product("presunto", 25.0, 1);
        orderService.create(order("Joana", item(a, 2)));
        Map<Long, Integer> estoqueAntes = stockSnapshot();
        long pedidosAntes = orderRepository.count();
        long itensAntes = orderItemRepository.count();

        assertThatThrownBy(() -> orderService.create(order("Joana", item(a, 4), item(b, 2))))
                .isInstanceOf(InsufficientStockException.class)
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("Presunto")
                .hasMessageContaining("Disponível: 1")
                .hasMessageContaining("Solicitado: 2")
                .isInstanceOfSatisfying(InsufficientStockException.class, falta -> {
                    assertThat(falta.getProdutoId()).isEqualTo(b.getId());
                    assertThat(falta.getDisponivel()).isEqualTo(1);
                    assertThat(falta.getSolicitado()).isEqualTo(2);
                });

        assertThat(stockSnapshot()).isEqualTo(estoqueAntes);
        assertThat(orderRepository.count()).isEqualTo(pedidosAntes);
        assertThat(orderItemRepository.count()).isEqualTo(itensAntes);
    }

    @Test
    void unknownProductFailsWithNotFoundAndAppliesNothing() {
        Product a = product("manteiga", 9.0, 10);
        Product fantasma = Product.builder().id(987_654L).build();

        assertThatThrownBy(() -> orderService.create(order("Kaio", item(a, 1), item(fantasma, 1))))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Produto 987654 não encontrado");

        assertThat(stock(a)).isEqualTo(10);
        assertThat(orderRepository.count()).isZero();
    }

    @Test
    void snapshotsSurviveProductRenameAndReprice() {
        Product p = product("iogurte", 3.0, 10);
        OrderResponse pedido = orderService.create(order("Lia", item(p, 2)));

        productService.update(p.getId(), ProductRequest.builder()
                .nome("iogurte grego").preco(4.5).quantidadeEstoque(8).build());

        OrderResponse.Item item = orderService.get(pedido.getId()).getItens().get(0);
        assertThat(item.getNomeProduto()).isEqualTo("Iogurte");
        assertThat(item.getPrecoUnitario()).isEqualTo(3.0);
        assertThat(item.getValorTotalItem()).isEqualTo(6.0);
    }

    @Test
    void stockNeverNegativeAcrossOperations() {
        Product p = product("azeite", 30.0, 3);
        OrderResponse pedido = orderService.create(order("Mia", item(p, 3)));
        assertThatThrownBy(() -> orderService.create(order("Nina", item(p, 1))))
                .isInstanceOf(InsufficientStockException.class);
        orderService.update(pedido.getId(), order("Mia", item(p, 2)));
        orderService.delete(pedido.getId());

        assertThat(productRepository.findAll())
                .allSatisfy(prod -> assertThat(prod.getQuantidadeEstoque()).isGreaterThanOrEqualTo(0));
        assertThat(stock(p)).isEqualTo(3);
    }

    @Test
    void listUsesOffsetAndLimitInIdOrder() {
        Product p = product("vinagre", 3.0, 10);
        OrderResponse primeiro = orderService.create(order("Olga", item(p, 1)));
        OrderResponse segundo = orderService.create(order("Paulo", item(p, 1)));
        OrderResponse terceiro = orderService.create(order("Quitéria", item(p, 1)));

        assertThat(orderService.list(0, 100)).extracting(OrderResponse::getId)
                .containsExactly(primeiro.getId(), segundo.getId(), terceiro.getId());
        assertThat(orderService.list(1, 1)).extracting(OrderResponse::getId)
                .containsExactly(segundo.getId());
        assertThat(orderService.list(0, 100).get(2).getItens()).hasSize(1);
        assertThatThrownBy(() -> orderService.list(-1, 10)).isInstanceOf(ValidationException.class);
    }

    private Product product(String nome, double preco, int estoque) {
        return productService.create(ProductRequest.builder()
                .nome(nome)
                .preco(preco)
                .quantidadeEstoque(estoque)
                .build());
    }

    private int stock(Product p) {
        return productRepository.findById(p.getId()).orElseThrow().getQuantidadeEstoque();
    }

    private Map<Long, Integer> stockSnapshot() {
        return productRepository.findAll().stream()
                .collect(Collectors.toMap(Product::getId, Product::getQuantidadeEstoque));
    }

    private static OrderRequest.Item item(Product p, int quantidade) {
        return new OrderRequest.Item(p.getId(), quantidade);
    }

    private static OrderRequest order(String cliente, OrderRequest.Item... itens) {
        return OrderRequest.builder().cliente(cliente).itens(List.of(itens)).build();
    }
}
