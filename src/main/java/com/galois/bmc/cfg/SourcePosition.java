package com.galois.bmc.cfg;

import com.galois.bmc.proto.Protos;

/**
 * Position of an instruction in a source file.  A column of zero means
 * the column is not known.
 */
public class SourcePosition extends Position {
    private final String file;
    private final long line;
    private final long column;

    public SourcePosition(String functionName, String file, long line, long column) {
        super(functionName);
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("negative source coordinate " + line + ":" + column);
        }
        this.file = file == null ? "" : file;
        this.line = line;
        this.column = column;
    }

    public String getFile() { return file; }
    public long getLine() { return line; }
    public long getColumn() { return column; }

    public Protos.Position getPosRep() {
        return Protos.Position.newBuilder()
            .setCode(Protos.PositionCode.SourcePos)
            .setFunctionName(functionName)
            .setPath(file)
            .setLine(line)
            .setCol(column)
            .build();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SourcePosition)) return false;
        SourcePosition p = (SourcePosition) o;
        return p.line == line && p.column == column
            && p.file.equals(file) && p.functionName.equals(functionName);
    }

    @Override
    public int hashCode() {
        return (int) (31 * (31 * file.hashCode() + line) + column) ^ functionName.hashCode();
    }

    /** Rendered as in compiler diagnostics, e.g. {@code file main.c line 3 function main}. */
    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append("file ").append(file).append(" line ").append(line);
        if (column != 0) b.append(" column ").append(column);
        return b.append(" function ").append(functionName).toString();
    }
}
