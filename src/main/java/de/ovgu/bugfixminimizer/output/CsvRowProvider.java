package de.ovgu.bugfixminimizer.output;

/**
 * Turns objects into CSV rows, one column per constant of the enum <code>TColumn</code>.  The header row consists of
 * the constants' names.
 */
public class CsvRowProvider<TData, TContext, TColumn extends Enum<TColumn> & CsvColumnValueProvider<TData, TContext>> {
    private final TColumn[] columns;
    private final TContext context;

    public CsvRowProvider(Class<TColumn> columnsClass, TContext context) {
        this.columns = columnsClass.getEnumConstants();
        this.context = context;
    }

    public Object[] headerRow() {
        Object[] result = new Object[columns.length];
        for (int i = 0; i < columns.length; i++) {
            result[i] = columns[i].name();
        }
        return result;
    }

    public Object[] dataRow(TData data) {
        Object[] result = new Object[columns.length];
        for (int i = 0; i < columns.length; i++) {
            result[i] = columns[i].csvColumnValue(data, context);
        }
        return result;
    }
}
