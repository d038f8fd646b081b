package com.galois.bmc;

import java.util.Map;
import java.util.Properties;

import com.galois.bmc.proto.Protos;

/**
 * Settings of a verification run.  Defaults are those declared in the
 * protocol schema.
 */
public class BmcOptions {
    private Protos.BmcOptions.Builder opts;

    public BmcOptions() {
        opts = Protos.BmcOptions.newBuilder();
    }

    public BmcOptions( Protos.BmcOptions rep ) {
        opts = rep.toBuilder();
    }

    /**
     * Read options from properties named after the command-line options of
     * the checker.  Unknown properties are ignored.  Recognised names are
     * <code>unwind-max</code>, <code>unwindset</code> (a comma-separated list
     * of <code>loop-id:bound</code>), <code>symex-complexity-limit</code>,
     * <code>symex-complexity-failed-child-loops-limit</code>,
     * <code>memory-model</code> (<code>sc</code>, <code>tso</code> or
     * <code>pso</code>), <code>slice-formula</code>, <code>partial-loops</code>,
     * <code>unwinding-assertions</code>,
     * <code>max-field-sensitivity-array-size</code>,
     * <code>no-array-field-sensitivity</code>, <code>paths</code>
     * (<code>lifo</code> or <code>fifo</code>), <code>depth</code>,
     * <code>path-merging</code>, <code>solver-timeout</code> (milliseconds),
     * <code>validate-goto-model</code>, <code>incremental-loop</code>,
     * <code>unwind-min</code> and
     * <code>ignore-properties-before-unwind-min</code>.
     *
     * @throws IllegalArgumentException if a value cannot be parsed.
     */
    public static BmcOptions fromProperties( Properties p ) {
        BmcOptions o = new BmcOptions();
        for( Map.Entry<Object, Object> e : p.entrySet() ) {
            o.set( e.getKey().toString(), e.getValue().toString().trim() );
        }
        return o;
    }

    /**
     * Set one option by its command-line name.
     */
    public void set( String name, String value ) {
        switch( name ) {
        case "unwind-max":
            setUnwindMax( parseCount( name, value ) );
            break;
        case "unwindset":
            for( String entry : value.split(",") ) {
                String s = entry.trim();
                if( s.isEmpty() ) continue;
                int colon = s.lastIndexOf(':');
                if( colon <= 0 ) {
                    throw new IllegalArgumentException("Malformed unwindset entry: " + s);
                }
                setLoopBound( s.substring(0, colon), parseCount( name, s.substring(colon + 1) ) );
            }
            break;
        case "symex-complexity-limit":
            setComplexityLimit( parseCount( name, value ) );
            break;
        case "symex-complexity-failed-child-loops-limit":
            setFailedChildLoopsLimit( parseCount( name, value ) );
            break;
        case "memory-model":
            setMemoryModel( parseMemoryModel( value ) );
            break;
        case "slice-formula":
            setSliceFormula( parseFlag( value ) );
            break;
        case "partial-loops":
            setPartialLoops( parseFlag( value ) );
            break;
        case "unwinding-assertions":
            setUnwindingAssertions( parseFlag( value ) );
            break;
        case "max-field-sensitivity-array-size":
            setMaxFieldSensitivityArraySize( parseCount( name, value ) );
            break;
        case "no-array-field-sensitivity":
            if( parseFlag( value ) ) setMaxFieldSensitivityArraySize( 0 );
            break;
        case "paths":
            if( value.equals("lifo") ) {
                setPathStrategy( Protos.PathStrategy.DepthFirst );
            } else if( value.equals("fifo") ) {
                setPathStrategy( Protos.PathStrategy.BreadthFirst );
            } else {
                throw new IllegalArgumentException("Unknown path strategy: " + value);
            }
            break;
        case "depth":
            setDepth( parseCount( name, value ) );
            break;
        case "path-merging":
            setPathMerging( parseFlag( value ) );
            break;
        case "solver-timeout":
            setSolverTimeoutMs( parseCount( name, value ) );
            break;
        case "validate-goto-model":
            setValidateProgram( parseFlag( value ) );
            break;
        case "incremental-loop":
            if( value.isEmpty() ) {
                throw new IllegalArgumentException("incremental-loop expects a loop id");
            }
            setIncrementalLoop( value );
            break;
        case "unwind-min":
            setUnwindMin( parseCount( name, value ) );
            break;
        case "ignore-properties-before-unwind-min":
            setIgnorePropertiesBeforeUnwindMin( parseFlag( value ) );
            break;
        default:
            break;
        }
    }

    private static long parseCount( String name, String value ) {
        try {
            long n = Long.parseLong( value.trim() );
            if( n < 0 ) {
                throw new IllegalArgumentException( name + " must not be negative: " + value );
            }
            return n;
        } catch( NumberFormatException ex ) {
            throw new IllegalArgumentException( name + " expects a number, got " + value, ex );
        }
    }

    private static boolean parseFlag( String value ) {
        return value.isEmpty() || Boolean.parseBoolean( value );
    }

    private static Protos.MemoryModel parseMemoryModel( String value ) {
        switch( value ) {
        case "sc":
            return Protos.MemoryModel.SequentialConsistency;
        case "tso":
            return Protos.MemoryModel.TotalStoreOrder;
        case "pso":
            return Protos.MemoryModel.PartialStoreOrder;
        default:
            throw new IllegalArgumentException("Unknown memory model: " + value);
        }
    }

    /**
     * Set the bound applied to every loop and recursive call without a
     * specific bound.  Zero leaves them unbounded.
     */
    public void setUnwindMax( long n ) {
        opts.setUnwindMax( n );
    }

    public long getUnwindMax() {
        return opts.getUnwindMax();
    }

    /**
     * Set the bound of one loop.  Loops are named <code>function.N</code>;
     * recursion of a function is bounded under the function's name.
     */
    public void setLoopBound( String loopId, long bound ) {
        for( int i = 0; i != opts.getUnwindsetCount(); ++i ) {
            if( opts.getUnwindset(i).getLoopId().equals( loopId ) ) {
                opts.setUnwindset( i, Protos.LoopUnwind.newBuilder()
                                   .setLoopId( loopId ).setBound( bound ) );
                return;
            }
        }
        opts.addUnwindset( Protos.LoopUnwind.newBuilder().setLoopId( loopId ).setBound( bound ) );
    }

    /**
     * Return the bound for a loop: its own bound when one was set, and the
     * global bound otherwise.  Zero means unbounded.
     */
    public long getLoopBound( String loopId ) {
        for( Protos.LoopUnwind u : opts.getUnwindsetList() ) {
            if( u.getLoopId().equals( loopId ) ) {
                return u.getBound();
            }
        }
        return opts.getUnwindMax();
    }

    /**
     * Paths whose guard grows beyond this many nodes are abandoned.  Zero
     * disables the check.
     */
    public void setComplexityLimit( long n ) {
        opts.setComplexityLimit( n );
    }

    public long getComplexityLimit() {
        return opts.getComplexityLimit();
    }

    /**
     * A loop is blacklisted once this many paths inside one of its
     * iterations were abandoned for complexity.  Zero disables blacklisting.
     */
    public void setFailedChildLoopsLimit( long n ) {
        opts.setFailedChildLoopsLimit( n );
    }

    public long getFailedChildLoopsLimit() {
        return opts.getFailedChildLoopsLimit();
    }

    public void setMemoryModel( Protos.MemoryModel m ) {
        opts.setMemoryModel( m );
    }

    public Protos.MemoryModel getMemoryModel() {
        return opts.getMemoryModel();
    }

    /** Remove equation steps that cannot affect any undecided property. */
    public void setSliceFormula( boolean b ) {
        opts.setSliceFormula( b );
    }

    public boolean isSliceFormula() {
        return opts.getSliceFormula();
    }

    /**
     * Continue after a loop reaches its bound without assuming that the
     * loop exits.
     */
    public void setPartialLoops( boolean b ) {
        opts.setPartialLoops( b );
    }

    public boolean isPartialLoops() {
        return opts.getPartialLoops();
    }

    /**
     * Add an assertion at each loop bound that fails if the loop could run
     * for more iterations.
     */
    public void setUnwindingAssertions( boolean b ) {
        opts.setUnwindingAssertions( b );
    }

    public boolean isUnwindingAssertions() {
        return opts.getUnwindingAssertions();
    }

    /**
     * Arrays with at most this many elements and a constant size are
     * tracked element by element.  Zero disables field sensitivity for
     * arrays.
     */
    public void setMaxFieldSensitivityArraySize( long n ) {
        opts.setMaxFieldSensitivityArraySize( n );
    }

    public long getMaxFieldSensitivityArraySize() {
        return opts.getMaxFieldSensitivityArraySize();
    }

    public void setPathStrategy( Protos.PathStrategy s ) {
        opts.setPathStrategy( s );
    }

    public Protos.PathStrategy getPathStrategy() {
        return opts.getPathStrategy();
    }

    /**
     * Explore both sides of a branch in one path and merge the states where
     * control flow joins, instead of forking.
     */
    public void setPathMerging( boolean b ) {
        opts.setPathMerging( b );
    }

    public boolean isPathMerging() {
        return opts.getPathMerging();
    }

    /** Maximum number of instructions executed on one path; zero for none. */
    public void setDepth( long n ) {
        opts.setDepth( n );
    }

    public long getDepth() {
        return opts.getDepth();
    }

    /** Time limit handed to the decision procedure per solver call. */
    public void setSolverTimeoutMs( long ms ) {
        opts.setSolverTimeoutMs( ms );
    }

    public long getSolverTimeoutMs() {
        return opts.getSolverTimeoutMs();
    }

    /** Fully validate the program before executing it. */
    public void setValidateProgram( boolean b ) {
        opts.setValidateProgram( b );
    }

    public boolean isValidateProgram() {
        return opts.getValidateProgram();
    }

    /**
     * Check the properties after each unwinding of one loop, from
     * <code>unwind-min</code> up to <code>unwind-max</code>, instead of once
     * at the final bound.  An empty id turns incremental checking off.
     */
    public void setIncrementalLoop( String loopId ) {
        opts.setIncrementalLoop( loopId );
    }

    public String getIncrementalLoop() {
        return opts.getIncrementalLoop();
    }

    public boolean isIncrementalLoop() {
        return !opts.getIncrementalLoop().isEmpty();
    }

    public void setUnwindMin( long n ) {
        opts.setUnwindMin( n );
    }

    public long getUnwindMin() {
        return opts.getUnwindMin();
    }

    public void setIgnorePropertiesBeforeUnwindMin( boolean b ) {
        opts.setIgnorePropertiesBeforeUnwindMin( b );
    }

    public boolean isIgnorePropertiesBeforeUnwindMin() {
        return opts.getIgnorePropertiesBeforeUnwindMin();
    }

    /** An independent copy of these options. */
    public BmcOptions copy() {
        return new BmcOptions( getRep() );
    }

    public Protos.BmcOptions getRep() {
        return opts.build();
    }

    public String toString() {
        return getRep().toString();
    }
}
