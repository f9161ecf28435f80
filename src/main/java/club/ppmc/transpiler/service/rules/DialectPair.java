package club.ppmc.transpiler.service.rules;

import club.ppmc.transpiler.model.Dialect;

/** 有序的（源方言，目标方言）组合。 */
public record DialectPair(Dialect source, Dialect target) {

    public static DialectPair of(Dialect source, Dialect target) {
        return new DialectPair(source, target);
    }

    @Override
    public String toString() {
        return source.label() + " -> " + target.label();
    }
}
