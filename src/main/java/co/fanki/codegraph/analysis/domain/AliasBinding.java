package co.fanki.codegraph.analysis.domain;

/**
 * What a local name was last bound to, as far as the micro-trace cares.
 *
 * @param kind the shape of the bound value
 * @param value the class name for CONSTRUCT, the aliased name for ALIAS,
 *        null otherwise
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
record AliasBinding(Kind kind, String value) {

    enum Kind {
        /** {@code x = new X()}. */
        CONSTRUCT,
        /** {@code x = y}. */
        ALIAS,
        /** x is a parameter of the function. */
        PARAMETER,
        /** Any other value: a call, a member access, a catch parameter. */
        OPAQUE
    }

    static final AliasBinding PARAMETER = new AliasBinding(Kind.PARAMETER,
            null);

    static final AliasBinding OPAQUE = new AliasBinding(Kind.OPAQUE, null);

    static AliasBinding construct(final String className) {
        return new AliasBinding(Kind.CONSTRUCT, className);
    }

    static AliasBinding alias(final String name) {
        return new AliasBinding(Kind.ALIAS, name);
    }

}
