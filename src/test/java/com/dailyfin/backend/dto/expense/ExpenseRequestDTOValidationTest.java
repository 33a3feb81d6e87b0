package com.dailyfin.backend.dto.expense;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

class ExpenseRequestDTOValidationTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void amountZero_isRejected() {
        Set<ConstraintViolation<ExpenseRequestDTO>> violations = validator.validate(request("0"));

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactly("Valor deve ser maior que zero");
    }

    @Test
    void amountNegative_isRejected() {
        Set<ConstraintViolation<ExpenseRequestDTO>> violations = validator.validate(request("-5"));

        assertThat(violations).extracting(v -> v.getPropertyPath().toString())
                .containsExactly("amount");
    }

    @Test
    void amountOneCent_isAccepted() {
        assertThat(validator.validate(request("0.01"))).isEmpty();
    }

    @Test
    void amountMissing_isRejected() {
        ExpenseRequestDTO dto = request("10");
        dto.setAmount(null);

        assertThat(validator.validate(dto)).extracting(ConstraintViolation::getMessage)
                .containsExactly("Valor é obrigatório");
    }

    private ExpenseRequestDTO request(String amount) {
        ExpenseRequestDTO dto = new ExpenseRequestDTO();
        dto.setCategoryId(UUID.randomUUID());
        dto.setAmount(new BigDecimal(amount));
        return dto;
    }
}
