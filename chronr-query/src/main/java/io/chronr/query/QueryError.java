package io.chronr.query;

/**
 * Why a query produced no {@link io.chronr.query.result.Aggregate}.
 * 
 * {@link WrongNumberArguments}, {@link BadArgument} and {@link InvalidAggregator} come from validation,
 * before anything is scheduled. {@link RuntimeFault} comes from execution.
 */
public abstract class QueryError {

    QueryError() {}

    public abstract String message();

    public boolean isValidationError() {
        return true;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + message() + ")";
    }
}
