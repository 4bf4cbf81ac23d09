package domain.graph;

/** A mapping edge was added without a DML target, or its target side is not the current target. */
public class InvalidMappingException extends QueryGraphException {

    public InvalidMappingException(String message) {
        super(message);
    }
}
