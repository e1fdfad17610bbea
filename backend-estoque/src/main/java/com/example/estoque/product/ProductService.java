package com.example.estoque.product;

import com.example.estoque.common.ConflictException;
import com.example.estoque.common.NotFoundException;
import com.example.estoque.common.OffsetBasedPageRequest;
import com.example.estoque.common.ScopedTransaction;
import com.example.estoque.common.ValidationException;
import com.example.estoque.config.AppProperties;
import com.example.estoque.order.OrderItemRepository;
import com.example.estoque.utils.NameNormalizer;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Operações do catálogo. Toda escrita passa por {@link ScopedTransaction};
 * nomes são normalizados antes de gravar e antes da checagem de unicidade.
 */
@Service
@RequiredArgsConstructor
public class ProductService {

    private static final Logger log = LoggerFactory.getLogger(ProductService.class);

    static final String MSG_PRODUTO_NAO_ENCONTRADO = "Produto não encontrado";
    static final String MSG_NOME_DUPLICADO = "Produto com este nome já existe";
    static final String MSG_PRODUTO_EM_USO = "Não é possível excluir produto que está em pedidos";

    private final ProductRepository productRepository;
    private final OrderItemRepository orderItemRepository;
    private final ScopedTransaction transaction;
    private final AppProperties appProperties;

    public Product create(ProductRequest req) {
        String nome = requireNome(req.getNome());
        validatePrecoEEstoque(req.getPreco(), req.getQuantidadeEstoque());

        Product produto = transaction.execute("criar produto", nome, () -> {
            if (productRepository.findByNome(nome).isPresent()) {
                throw new ConflictException(MSG_NOME_DUPLICADO);
            }
            return productRepository.saveAndFlush(Product.builder()
                    .nome(nome)
                    .descricao(NameNormalizer.trimToNull(req.getDescricao()))
                    .preco(req.getPreco())
                    .quantidadeEstoque(req.getQuantidadeEstoque())
                    .build());
        });
        log.info("Produto criado com sucesso: {} - {}", produto.getId(), produto.getNome());
        return produto;
    }

    public Product get(Long id) {
        return transaction.readOnly("buscar produto", id, () -> productRepository.findById(id)
                .orElseThrow(() -> new NotFoundException(MSG_PRODUTO_NAO_ENCONTRADO)));
    }

    public List<Product> list(int skip, int limit, ProductFilter filtro) {
        OffsetBasedPageRequest page = OffsetBasedPageRequest.of(skip, limit,
                appProperties.getPaginacao().getLimiteMaximo(), Sort.by("id"));
        ProductFilter efetivo = filtro != null ? filtro : ProductFilter.empty();
        return transaction.readOnly("listar produtos", null,
                () -> productRepository.findAll(efetivo.toSpecification(), page).getContent());
    }

    public Product update(Long id, ProductRequest req) {
        Product produto = transaction.execute("atualizar produto", id, () -> {
            Product existente = productRepository.findById(id)
                    .orElseThrow(() -> new NotFoundException(MSG_PRODUTO_NAO_ENCONTRADO));

            String nome = requireNome(req.getNome());
            validatePrecoEEstoque(req.getPreco(), req.getQuantidadeEstoque());
            if (!nome.equals(existente.getNome()) && productRepository.existsByNomeAndIdNot(nome, id)) {
                throw new ConflictException(MSG_NOME_DUPLICADO);
            }

            // snapshots em itens_pedido não são tocados: registram o histórico da venda
            existente.setNome(nome);
            existente.setDescricao(NameNormalizer.trimToNull(req.getDescricao()));
            existente.setPreco(req.getPreco());
            existente.setQuantidadeEstoque(req.getQuantidadeEstoque());
            return productRepository.saveAndFlush(existente);
        });
        log.info("Produto atualizado com sucesso: {} - {}", produto.getId(), produto.getNome());
        return produto;
    }

    public Product updateEstoque(Long id, Integer quantidadeEstoque) {
        if (quantidadeEstoque == null || quantidadeEstoque < 0) {
            throw new ValidationException("Quantidade de estoque deve ser um número não negativo");
        }
        Product produto = transaction.execute("atualizar estoque", id, () -> {
            Product existente = productRepository.findByIdForUpdate(id)
                    .orElseThrow(() -> new NotFoundException(MSG_PRODUTO_NAO_ENCONTRADO));
            existente.setQuantidadeEstoque(quantidadeEstoque);
            return productRepository.saveAndFlush(existente);
        });
        log.info("Estoque do produto {} ajustado para {}", id, quantidadeEstoque);
        return produto;
    }

    public StockAvailability checkAvailability(Long id, int quantidade) {
        if (quantidade <= 0) {
            throw new ValidationException("Quantidade deve ser maior que zero");
        }
        return transaction.readOnly("verificar estoque", id, () -> {
            Product produto = productRepository.findById(id)
                    .orElseThrow(() -> new NotFoundException(MSG_PRODUTO_NAO_ENCONTRADO));
            int estoque = produto.getQuantidadeEstoque();
            return new StockAvailability(id, quantidade, estoque, estoque >= quantidade);
        });
    }

    public void delete(Long id) {
        String nome = transaction.execute("deletar produto", id, () -> {
            Product produto = productRepository.findById(id)
                    .orElseThrow(() -> new NotFoundException(MSG_PRODUTO_NAO_ENCONTRADO));
            if (orderItemRepository.existsByProdutoId(id)) {
                throw new ConflictException(MSG_PRODUTO_EM_USO);
            }
            productRepository.delete(produto);
            productRepository.flush();
            return produto.getNome();
        });
        log.info("Produto deletado com sucesso: {} - {}", id, nome);
    }

    private static String requireNome(String nome) {
        if (!StringUtils.hasText(nome)) {
            throw new ValidationException("Nome do produto é obrigatório");
        }
        return NameNormalizer.normalize(nome);
    }

    private static void validatePrecoEEstoque(Double preco, Integer quantidadeEstoque) {
        if (preco == null || preco <= 0) {
            throw new ValidationException("Preço deve ser maior que zero");
        }
        if (quantidadeEstoque == null || quantidadeEstoque < 0) {
            throw new ValidationException("Quantidade em estoque não pode ser negativa");
        }
    }
}
