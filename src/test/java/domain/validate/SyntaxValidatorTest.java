package domain.validate;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SyntaxValidatorTest {

    private final SyntaxValidator validator = new SyntaxValidator();

    @Test
    void generated_select_is_valid() {
        ValidationResult r = validator.validate("SELECT A.id, A.name\nFROM A\nINNER JOIN B ON A.id=B.aid\nWHERE A.name = 'x'");

        assertTrue(r.isValid(), r.getMessage());
        assertEquals("Valid.", r.getMessage());
    }

    @Test
    void broken_statement_is_invalid_with_reason() {
        ValidationResult r = validator.validate("SELECT FROM WHERE");

        assertFalse(r.isValid());
        assertEquals(ValidationResult.Status.INVALID, r.getStatus());
        assertTrue(r.getMessage().startsWith("Invalid - "), r.getMessage());
    }

    @Test
    void comment_only_output_is_incomplete() {
        ValidationResult r = validator.validate("-- No target table marked for UPDATE => no UPDATE.");

        assertEquals(ValidationResult.Status.INCOMPLETE, r.getStatus());
        assertFalse(r.isValid());
    }

    @Test
    void blank_text_is_empty() {
        assertEquals(ValidationResult.Status.EMPTY, validator.validate("  ").getStatus());
        assertEquals(ValidationResult.Status.EMPTY, validator.validate(null).getStatus());
    }
}
