package com.galois.bmc;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.expr.BvConstant;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.proto.Protos;

/**
 * Types of goto program expressions.
 *
 * <p>
 * Types are immutable and compared structurally.  Struct types may be
 * referred to by tag; tags are resolved through a {@link SymbolTable}.
 */
public final class Type {
    final Protos.TypeId id;
    final long width;
    final Type[] params;
    final List<Component> components;
    final String tag;
    final Expr size;

    /**
     * A named component of a struct type.
     */
    public static final class Component {
        private final String name;
        private final Type type;
        private final boolean padding;

        public Component(String name, Type type) {
            this(name, type, false);
        }

        /**
         * Create a component.
         * @param name component name
         * @param type component type
         * @param padding whether this component only holds padding bits
         */
        public Component(String name, Type type, boolean padding) {
            if (name == null) throw new NullPointerException("name");
            if (type == null) throw new NullPointerException("type");
            this.name = name;
            this.type = type;
            this.padding = padding;
        }

        public String getName() {
            return name;
        }

        public Type getType() {
            return type;
        }

        public boolean isPadding() {
            return padding;
        }

        Protos.Component getComponentRep() {
            return Protos.Component.newBuilder()
                .setName(name)
                .setType(type.getTypeRep())
                .setPadding(padding)
                .build();
        }

        public boolean equals(Object o) {
            if (!(o instanceof Component)) return false;
            Component other = (Component) o;
            return name.equals(other.name)
                && type.equals(other.type)
                && padding == other.padding;
        }

        public int hashCode() {
            return Arrays.hashCode(new Object[] { name, type, padding });
        }

        public String toString() {
            return type + " " + name;
        }
    }

    private Type(Protos.TypeId id, long width, Type[] params,
                 List<Component> components, String tag, Expr size) {
        this.id = id;
        this.width = width;
        this.params = params;
        this.components = components;
        this.tag = tag;
        this.size = size;
    }

    private Type(Protos.TypeId id, long width) {
        this(id, width, new Type[0], Collections.<Component>emptyList(), null, null);
    }

    /**
     * Type for Boolean values (true or false)
     */
    public static final Type BOOL = new Type(Protos.TypeId.BoolType, 0);

    /**
     * The type of statements and functions that do not return a value.
     */
    public static final Type EMPTY = new Type(Protos.TypeId.EmptyType, 0);

    /**
     * Type for string constants, used to describe input and output annotations.
     */
    public static final Type STRING = new Type(Protos.TypeId.StringType, 0);

    /**
     * Returns the type of an unsigned bitvector with <code>width</code> bits.
     *
     * @param width The number of bits in bitvector.
     * @return The given type.
     */
    public static Type unsignedbv(long width) {
        checkWidth(width);
        return new Type(Protos.TypeId.UnsignedBvType, width);
    }

    /**
     * Returns the type of a two's complement bitvector with <code>width</code> bits.
     *
     * @param width The number of bits in bitvector.
     * @return The given type.
     */
    public static Type signedbv(long width) {
        checkWidth(width);
        return new Type(Protos.TypeId.SignedBvType, width);
    }

    /**
     * Returns the type of a raw bitvector with <code>width</code> bits.  Raw
     * bitvectors have no numeric interpretation; they are the result of
     * flattening structured types.
     *
     * @param width The number of bits in bitvector.
     * @return The given type.
     */
    public static Type bv(long width) {
        checkWidth(width);
        return new Type(Protos.TypeId.BvType, width);
    }

    /**
     * Type used for array sizes and indices when none is given.
     */
    public static final Type INDEX = signedbv(64);

    private static void checkWidth(long width) {
        if (width < 0) {
            throw new IllegalArgumentException("Bitvector width must not be negative.");
        }
    }

    /**
     * Type for a struct with the given components, in declaration order.
     *
     * @param components The components of the struct.
     * @return The resulting type.
     */
    public static Type struct(Component... components) {
        return struct(Arrays.asList(components));
    }

    /**
     * Type for a struct with the given components, in declaration order.
     *
     * @param components The components of the struct.
     * @return The resulting type.
     */
    public static Type struct(List<Component> components) {
        List<String> seen = new ArrayList<String>();
        for (Component c : components) {
            if (seen.contains(c.getName())) {
                throw new IllegalArgumentException("Duplicate struct component: " + c.getName());
            }
            seen.add(c.getName());
        }
        List<Component> copy =
            Collections.unmodifiableList(new ArrayList<Component>(components));
        return new Type(Protos.TypeId.StructType, 0, new Type[0], copy, null, null);
    }

    /**
     * Type referring to the struct type registered under <code>tag</code>.
     *
     * @param tag the name of the type symbol.
     * @return The tag type.
     */
    public static Type structTag(String tag) {
        if (tag == null) throw new NullPointerException("tag");
        return new Type(Protos.TypeId.StructTagType, 0, new Type[0],
                        Collections.<Component>emptyList(), tag, null);
    }

    /**
     * An array whose elements are of type <code>element</code>.
     *
     * @param element The type of the elements of the array.
     * @param size Expression for the number of elements.
     * @return The array type.
     */
    public static Type array(Type element, Expr size) {
        if (element == null) throw new NullPointerException("element");
        if (size == null) throw new NullPointerException("size");
        if (!size.type().isBitvector()) {
            throw new IllegalArgumentException("Array size must be a bitvector.");
        }
        return new Type(Protos.TypeId.ArrayType, 0, new Type[] { element },
                        Collections.<Component>emptyList(), null, size);
    }

    /**
     * An array of <code>size</code> elements with a size expression of type
     * {@link #INDEX}.
     */
    public static Type array(Type element, long size) {
        return array(element, new BvConstant(INDEX, BigInteger.valueOf(size)));
    }

    /**
     * Type for functions with given parameter and return types.
     *
     * @param args Types of function arguments.
     * @param ret Return type of function
     * @return the code type
     */
    public static Type code(Type[] args, Type ret) {
        Type[] params = Arrays.copyOf(args, args.length + 1);
        params[args.length] = ret;
        return new Type(Protos.TypeId.CodeType, 0, params,
                        Collections.<Component>emptyList(), null, null);
    }

    public Protos.TypeId getId() {
        return id;
    }

    public boolean isBool() {
        return id == Protos.TypeId.BoolType;
    }

    public boolean isEmpty() {
        return id == Protos.TypeId.EmptyType;
    }

    public boolean isString() {
        return id == Protos.TypeId.StringType;
    }

    /**
     * Check if this is a bitvector type, signed, unsigned or raw.
     * @return Whether this is a bitvector type.
     */
    public boolean isBitvector() {
        return id == Protos.TypeId.UnsignedBvType
            || id == Protos.TypeId.SignedBvType
            || id == Protos.TypeId.BvType;
    }

    /**
     * Check if this is a two's complement bitvector type.
     */
    public boolean isSigned() {
        return id == Protos.TypeId.SignedBvType;
    }

    public boolean isStruct() {
        return id == Protos.TypeId.StructType;
    }

    public boolean isStructTag() {
        return id == Protos.TypeId.StructTagType;
    }

    public boolean isArray() {
        return id == Protos.TypeId.ArrayType;
    }

    public boolean isCode() {
        return id == Protos.TypeId.CodeType;
    }

    /**
     * Whether this type is a struct, a struct tag or an array.
     */
    public boolean isAggregate() {
        return isStruct() || isStructTag() || isArray();
    }

    /**
     * Return width of this type if it is a bitvector, and <code>0</code> otherwise.
     * @return The width
     */
    public long width() {
        return width;
    }

    /**
     * Return the components of a struct type.
     * @return the components in declaration order.
     */
    public List<Component> components() {
        if (!isStruct()) {
            throw new UnsupportedOperationException("Expected struct type");
        }
        return components;
    }

    /**
     * Return the component with the given name, or <code>null</code>.
     */
    public Component component(String name) {
        for (Component c : components()) {
            if (c.getName().equals(name)) {
                return c;
            }
        }
        return null;
    }

    /**
     * Return the index of the named component, or <code>-1</code>.
     */
    public int componentIndex(String name) {
        List<Component> l = components();
        for (int i = 0; i != l.size(); ++i) {
            if (l.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    public String tag() {
        if (!isStructTag()) {
            throw new UnsupportedOperationException("Expected struct tag type");
        }
        return tag;
    }

    /**
     * Return the element type of an array type.
     * @return The element type of this array type.
     */
    public Type arrayElementType() {
        if (!isArray()) {
            throw new UnsupportedOperationException("Expected array type");
        }
        return params[0];
    }

    /**
     * Return the size expression of an array type.
     */
    public Expr arraySize() {
        if (!isArray()) {
            throw new UnsupportedOperationException("Expected array type");
        }
        return size;
    }

    /**
     * Return the number of elements of an array type when the size is a
     * constant, and <code>-1</code> otherwise.
     */
    public long constantArraySize() {
        Expr s = arraySize();
        if (s instanceof BvConstant) {
            return ((BvConstant) s).getValue().longValue();
        }
        return -1;
    }

    /**
     * Return the number of parameters of a code type.
     */
    public int getCodeParameterCount() {
        if (!isCode()) {
            throw new UnsupportedOperationException("Expected code type");
        }
        return params.length - 1;
    }

    /**
     * Return the type of a code parameter at a given 0-based index.
     * @param i index of parameter
     * @return the type
     */
    public Type getCodeParameterType(int i) {
        if (i < 0 || i >= getCodeParameterCount()) {
            throw new IllegalArgumentException("Function parameter is out of bounds.");
        }
        return params[i];
    }

    /**
     * Return code return type.
     * @return the return type
     */
    public Type getCodeReturnType() {
        if (!isCode()) {
            throw new UnsupportedOperationException("Expected code type");
        }
        return params[params.length - 1];
    }

    /**
     * Return protocol buffer representation for type.
     * @return the representation
     */
    public Protos.Type getTypeRep() {
        Protos.Type.Builder b
            = Protos.Type.newBuilder()
            .setId(id)
            .setWidth(width);
        for (Type param : params) {
            b.addParam(param.getTypeRep());
        }
        for (Component c : components) {
            b.addComponent(c.getComponentRep());
        }
        if (tag != null) {
            b.setTag(tag);
        }
        if (size != null) {
            b.setSize(size.toString());
        }
        return b.build();
    }

    public String toString() {
        switch (id) {
        case BoolType:
            return "bool";
        case UnsignedBvType:
            return "unsignedbv[" + width + "]";
        case SignedBvType:
            return "signedbv[" + width + "]";
        case BvType:
            return "bv[" + width + "]";
        case StructType:
            return "struct " + components;
        case StructTagType:
            return "struct_tag " + tag;
        case ArrayType:
            return params[0] + "[" + size + "]";
        case CodeType:
            return "code " + Arrays.asList(params).subList(0, params.length - 1)
                + " -> " + params[params.length - 1];
        case EmptyType:
            return "empty";
        case StringType:
            return "string";
        default:
            return id.toString();
        }
    }

    /**
     * Returns true if <code>this</code> and <code>o</code> are the same type.
     * Tags are compared by name; they are not resolved.
     * @param o the other type.
     * @return whether the types are the same.
     */
    public boolean equals(Object o) {
        if (!(o instanceof Type)) return false;
        Type other = (Type) o;
        return this.id.equals(other.id)
            && this.width == other.width
            && Arrays.equals(this.params, other.params)
            && this.components.equals(other.components)
            && (tag == null ? other.tag == null : tag.equals(other.tag))
            && (size == null ? other.size == null : size.equals(other.size));
    }

    public int hashCode() {
        return Arrays.hashCode(new Object[] {
                id, width, Arrays.hashCode(params), components, tag, size });
    }
}
