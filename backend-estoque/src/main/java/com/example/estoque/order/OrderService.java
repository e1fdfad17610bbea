package com.example.estoque.order;

import com.example.estoque.common.NotFoundException;
import com.example.estoque.common.OffsetBasedPageRequest;
import com.example.estoque.common.ScopedTransaction;
import com.example.estoque.common.ValidationException;
import com.example.estoque.config.AppProperties;
import com.example.estoque.utils.NameNormalizer;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Criação, atualização e exclusão de pedidos com controle de estoque. Cada
 * operação é uma única transação: ou estoque, pedido e itens mudam juntos, ou
 * nada muda.
 */
@Service
@RequiredArgsConstructor
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);
    private static final String MSG_PEDIDO_NAO_ENCONTRADO = "Pedido não encontrado";

    private final CustomerOrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;
    private final StockReconciler stockReconciler;
    private final ScopedTransaction transaction;
    private final AppProperties appProperties;

    public OrderResponse create(OrderRequest req) {
        String cliente = requireCliente(req.getCliente());
        StockReconciler.validateItens(req.getItens());

        OrderResponse criado = transaction.execute("criar pedido", null, () -> {
            List<StockReconciler.PlannedLine> plano = stockReconciler.plan(req.getItens());

            // flush para obter o id antes de gravar os itens
            CustomerOrder pedido = orderRepository.saveAndFlush(CustomerOrder.builder()
                    .cliente(cliente)
                    .valorTotal(StockReconciler.total(plano))
                    .build());
            List<OrderItem> itens = stockReconciler.checkout(pedido.getId(), plano);
            return OrderResponse.of(pedido, itens);
        });
        log.info("Pedido criado com sucesso: {} - Cliente: {}", criado.getId(), criado.getCliente());
        return criado;
    }

    public OrderResponse get(Long id) {
        return transaction.readOnly("buscar pedido", id, () -> {
            CustomerOrder pedido = orderRepository.findById(id)
                    .orElseThrow(() -> new NotFoundException(MSG_PEDIDO_NAO_ENCONTRADO));
            return OrderResponse.of(pedido, orderItemRepository.findByPedidoIdOrderByIdAsc(id));
        });
    }

    public List<OrderResponse> list(int skip, int limit) {
        OffsetBasedPageRequest page = OffsetBasedPageRequest.of(skip, limit,
                appProperties.getPaginacao().getLimiteMaximo(), Sort.by("id"));
        return transaction.readOnly("listar pedidos", null, () -> {
            List<CustomerOrder> pedidos = orderRepository.findAll(page).getContent();
            if (pedidos.isEmpty()) {
                return List.<OrderResponse>of();
            }
            Map<Long, List<OrderItem>> itensPorPedido = orderItemRepository
                    .findByPedidoIdInOrderByIdAsc(pedidos.stream().map(CustomerOrder::getId).toList())
                    .stream()
                    .collect(Collectors.groupingBy(OrderItem::getPedidoId));
            return pedidos.stream()
                    .map(p -> OrderResponse.of(p, itensPorPedido.getOrDefault(p.getId(), List.of())))
                    .toList();
        });
    }

    /**
     * Estorna os itens atuais e aplica a nova lista. O estorno vem antes da
     * validação dos novos itens, então um produto pedido de novo enxerga o
     * estoque já devolvido. Se a nova lista falhar, o rollback desfaz o estorno.
     */
    public OrderResponse update(Long id, OrderRequest req) {
        OrderResponse atualizado = transaction.execute("atualizar pedido", id, () -> {
            CustomerOrder pedido = orderRepository.findByIdForUpdate(id)
                    .orElseThrow(() -> new NotFoundException(MSG_PEDIDO_NAO_ENCONTRADO));
            String cliente = requireCliente(req.getCliente());
            StockReconciler.validateItens(req.getItens());

            stockReconciler.reverse(orderItemRepository.findByPedidoIdOrderByIdAsc(id));

            List<StockReconciler.PlannedLine> plano = stockReconciler.plan(req.getItens());
            pedido.setCliente(cliente);
            pedido.setValorTotal(StockReconciler.total(plano));
            orderRepository.save(pedido);
            List<OrderItem> itens = stockReconciler.checkout(pedido.getId(), plano);
            orderRepository.flush();
            return OrderResponse.of(pedido, itens);
        });
        log.info("Pedido atualizado com sucesso: {} - Cliente: {}", atualizado.getId(), atualizado.getCliente());
        return atualizado;
    }

    public void delete(Long id) {
        String cliente = transaction.execute("deletar pedido", id, () -> {
            CustomerOrder pedido = orderRepository.findByIdForUpdate(id)
                    .orElseThrow(() -> new NotFoundException(MSG_PEDIDO_NAO_ENCONTRADO));
            stockReconciler.reverse(orderItemRepository.findByPedidoIdOrderByIdAsc(id));
            orderRepository.delete(pedido);
            orderRepository.flush();
            return pedido.getCliente();
        });
        log.info("Pedido deletado com sucesso: {} - Cliente: {}", id, cliente);
    }

    private static String requireCliente(String cliente) {
        if (!StringUtils.hasText(cliente)) {
            throw new ValidationException("Nome do cliente é obrigatório");
        }
        return NameNormalizer.normalize(cliente);
    }
}
