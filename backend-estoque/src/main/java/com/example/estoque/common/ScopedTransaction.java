package com.example.estoque.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Escopo transacional único para todas as operações da API: abre a
 * transação, executa a regra de negócio, faz commit em caso de sucesso e
 * rollback em qualquer falha. Erros de negócio ({@link ApiException}) passam
 * intactos; violações de integridade viram {@link ConflictException} e o
 * restante vira {@link InternalException}, sempre com log da operação e do id
 * envolvido.
 */
@Component
public class ScopedTransaction {

    private static final Logger log = LoggerFactory.getLogger(ScopedTransaction.class);

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readOnlyTemplate;

    public ScopedTransaction(PlatformTransactionManager transactionManager) {
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
    }

    public <T> T execute(String operacao, Object entidadeId, Supplier<T> work) {
        return run(writeTemplate, operacao, entidadeId, work);
    }

    public <T> T readOnly(String operacao, Object entidadeId, Supplier<T> work) {
        return run(readOnlyTemplate, operacao, entidadeId, work);
    }

    private <T> T run(TransactionTemplate template, String operacao, Object entidadeId, Supplier<T> work) {
        try {
            return template.execute(status -> work.get());
        } catch (ApiException e) {
            log.debug("Operação '{}' (id={}) rejeitada: {}", operacao, entidadeId, e.getMessage());
            throw e;
        } catch (DataIntegrityViolationException e) {
            log.warn("Violação de integridade em '{}' (id={}): {}", operacao, entidadeId,
                    e.getMostSpecificCause().getMessage());
            throw new ConflictException("Violação de integridade dos dados", e);
        } catch (RuntimeException e) {
            log.error("Erro de persistência em '{}' (id={})", operacao, entidadeId, e);
            throw new InternalException(e);
        }
    }
}
