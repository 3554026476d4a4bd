package com.rcl.compiler.analysis.typereq;

import com.rcl.compiler.analysis.types.RclType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 静态类型检查的结果。
 *
 * <p>可以表示无错误、需要推迟到运行时的检查、不可再分的类型错误，
 * 以及嵌套在 List/Set/Dict/函数类型内部的类型错误。每次检查都会重新生成，不做持久化。</p>
 */
public abstract class TypeDiff {

    public enum Kind {
        OK, DEFER, ERROR, LIST, SET, DICT, FUNCTION
    }

    TypeDiff() {
    }

    public abstract Kind getKind();

    public abstract <R> R accept(TypeDiffVisitor<R> visitor);

    /** OK 与 DEFER 为已解决的结果，其余都包含类型错误 */
    public boolean isResolved() {
        return getKind() == Kind.OK || getKind() == Kind.DEFER;
    }

    public static Ok ok(RclType type) {
        return new Ok(type);
    }

    public static Defer defer(RclType type) {
        return new Defer(type);
    }

    public static Error error(TypeReq requirement, RclType actual) {
        return new Error(requirement, actual);
    }

    public static ListDiff list(TypeDiff element) {
        return new ListDiff(element);
    }

    public static SetDiff set(TypeDiff element) {
        return new SetDiff(element);
    }

    public static DictDiff dict(TypeDiff key, TypeDiff value) {
        return new DictDiff(key, value);
    }

    public static FunctionDiff function(List<TypeDiff> args, TypeDiff result) {
        return new FunctionDiff(args, result);
    }

    /** 无错误，实际类型满足要求 */
    public static final class Ok extends TypeDiff {
        private final RclType type;

        Ok(RclType type) {
            this.type = type;
        }

        public RclType getType() { return type; }

        @Override
        public Kind getKind() { return Kind.OK; }

        @Override
        public <R> R accept(TypeDiffVisitor<R> visitor) { return visitor.visitOk(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Ok && ((Ok) o).type.equals(type);
        }

        @Override
        public int hashCode() { return Objects.hash(Kind.OK, type); }

        @Override
        public String toString() { return "Ok(" + type + ")"; }
    }

    /** 无法静态检查，需要运行时检查 */
    public static final class Defer extends TypeDiff {
        private final RclType type;

        Defer(RclType type) {
            this.type = type;
        }

        public RclType getType() { return type; }

        @Override
        public Kind getKind() { return Kind.DEFER; }

        @Override
        public <R> R accept(TypeDiffVisitor<R> visitor) { return visitor.visitDefer(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof Defer && ((Defer) o).type.equals(type);
        }

        @Override
        public int hashCode() { return Objects.hash(Kind.DEFER, type); }

        @Override
        public String toString() { return "Defer(" + type + ")"; }
    }

    /**
     * 无法再拆分的静态类型不匹配。
     * 要求给出期望的类型及其原因，actual 是实际遇到的类型。
     */
    public static final class Error extends TypeDiff {
        private final TypeReq requirement;
        private final RclType actual;

        Error(TypeReq requirement, RclType actual) {
            this.requirement = requirement;
            this.actual = actual;
        }

        public TypeReq getRequirement() { return requirement; }
        public RclType getActual() { return actual; }

        @Override
        public Kind getKind() { return Kind.ERROR; }

        @Override
        public <R> R accept(TypeDiffVisitor<R> visitor) { return visitor.visitError(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Error)) return false;
            Error that = (Error) o;
            return requirement.equals(that.requirement) && actual.equals(that.actual);
        }

        @Override
        public int hashCode() { return Objects.hash(Kind.ERROR, requirement, actual); }

        @Override
        public String toString() { return "Error(" + requirement.toType() + ", " + actual + ")"; }
    }

    /** 列表元素类型中存在不匹配 */
    public static final class ListDiff extends TypeDiff {
        private final TypeDiff element;

        ListDiff(TypeDiff element) {
            this.element = element;
        }

        public TypeDiff getElement() { return element; }

        @Override
        public Kind getKind() { return Kind.LIST; }

        @Override
        public <R> R accept(TypeDiffVisitor<R> visitor) { return visitor.visitList(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof ListDiff && ((ListDiff) o).element.equals(element);
        }

        @Override
        public int hashCode() { return Objects.hash(Kind.LIST, element); }

        @Override
        public String toString() { return "List(" + element + ")"; }
    }

    /** 集合元素类型中存在不匹配 */
    public static final class SetDiff extends TypeDiff {
        private final TypeDiff element;

        SetDiff(TypeDiff element) {
            this.element = element;
        }

        public TypeDiff getElement() { return element; }

        @Override
        public Kind getKind() { return Kind.SET; }

        @Override
        public <R> R accept(TypeDiffVisitor<R> visitor) { return visitor.visitSet(this); }

        @Override
        public boolean equals(Object o) {
            return o instanceof SetDiff && ((SetDiff) o).element.equals(element);
        }

        @Override
        public int hashCode() { return Objects.hash(Kind.SET, element); }

        @Override
        public String toString() { return "Set(" + element + ")"; }
    }

    /** 字典类型中存在不匹配；键和值两侧的结果都会保留 */
    public static final class DictDiff extends TypeDiff {
        private final TypeDiff key;
        private final TypeDiff value;

        DictDiff(TypeDiff key, TypeDiff value) {
            this.key = key;
            this.value = value;
        }

        public TypeDiff getKey() { return key; }
        public TypeDiff getValue() { return value; }

        @Override
        public Kind getKind() { return Kind.DICT; }

        @Override
        public <R> R accept(TypeDiffVisitor<R> visitor) { return visitor.visitDict(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof DictDiff)) return false;
            DictDiff that = (DictDiff) o;
            return key.equals(that.key) && value.equals(that.value);
        }

        @Override
        public int hashCode() { return Objects.hash(Kind.DICT, key, value); }

        @Override
        public String toString() { return "Dict(" + key + ", " + value + ")"; }
    }

    /** 函数类型中存在不匹配 */
    public static final class FunctionDiff extends TypeDiff {
        private final List<TypeDiff> args;
        private final TypeDiff result;

        FunctionDiff(List<TypeDiff> args, TypeDiff result) {
            this.args = Collections.unmodifiableList(new ArrayList<TypeDiff>(args));
            this.result = result;
        }

        public List<TypeDiff> getArgs() { return args; }
        public TypeDiff getResult() { return result; }

        @Override
        public Kind getKind() { return Kind.FUNCTION; }

        @Override
        public <R> R accept(TypeDiffVisitor<R> visitor) { return visitor.visitFunction(this); }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof FunctionDiff)) return false;
            FunctionDiff that = (FunctionDiff) o;
            return args.equals(that.args) && result.equals(that.result);
        }

        @Override
        public int hashCode() { return Objects.hash(Kind.FUNCTION, args, result); }

        @Override
        public String toString() { return "Function(" + args + ", " + result + ")"; }
    }
}
