package com.sedmap.exception;

import java.util.Collection;

public class ColumnLookupException extends SedMapException {

    public ColumnLookupException(String name, Collection<String> available) {
        super("Column '" + name + "' not found. Available columns: " + available);
    }
}
