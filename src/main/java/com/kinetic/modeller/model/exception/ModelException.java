package com.kinetic.modeller.model.exception;

/**
 * Semantic hard failure: a reaction without movement or rate law, an unknown solver, an
 * unsupported specification type or a rate law that references something that is not an entity.
 */
public class ModelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ModelException(String message) {
        super(message);
    }

    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
