package de.ovgu.bugfixminimizer.output;

/**
 * A column of a CSV file.  Implemented by enums whose constants are the columns, in order.
 *
 * @param <TData>    Type of the object that one row describes
 * @param <TContext> Type of additional information shared by all rows of the file
 */
public interface CsvColumnValueProvider<TData, TContext> {
    Object csvColumnValue(TData data, TContext context);
}
