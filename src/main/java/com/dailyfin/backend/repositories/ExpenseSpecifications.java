package com.dailyfin.backend.repositories;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.UUID;

import org.springframework.data.jpa.domain.Specification;

import com.dailyfin.backend.entities.Expense;
import com.dailyfin.backend.enums.PaymentMethod;

/**
 * Blocos de filtro para a listagem paginada de despesas. Cada método retorna
 * {@code null} quando o filtro não foi informado, o que o {@code Specification.where/and}
 * ignora.
 */
public final class ExpenseSpecifications {

    private ExpenseSpecifications() {
    }

    public static Specification<Expense> ownedBy(UUID userId) {
        return (root, query, cb) -> cb.equal(root.get("user").get("id"), userId);
    }

    public static Specification<Expense> inCategory(UUID categoryId) {
        if (categoryId == null) return null;
        return (root, query, cb) -> cb.equal(root.get("category").get("id"), categoryId);
    }

    public static Specification<Expense> dateFrom(LocalDateTime start) {
        if (start == null) return null;
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("date"), start);
    }

    public static Specification<Expense> dateUntil(LocalDateTime end) {
        if (end == null) return null;
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.get("date"), end);
    }

    public static Specification<Expense> amountAtLeast(BigDecimal min) {
        if (min == null) return null;
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("amount"), min);
    }

    public static Specification<Expense> amountAtMost(BigDecimal max) {
        if (max == null) return null;
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.get("amount"), max);
    }

    public static Specification<Expense> paidWith(PaymentMethod method) {
        if (method == null) return null;
        return (root, query, cb) -> cb.equal(root.get("paymentMethod"), method);
    }

    // ANY: basta uma das tags informadas
    public static Specification<Expense> taggedWithAny(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) return null;
        return (root, query, cb) -> {
            var sub = query.subquery(UUID.class);
            var subRoot = sub.from(Expense.class);
            var tagJoin = subRoot.join("tags");
            sub.select(subRoot.get("id"))
                    .where(cb.equal(subRoot.get("id"), root.get("id")), tagJoin.in(tags));
            return cb.exists(sub);
        };
    }
}
