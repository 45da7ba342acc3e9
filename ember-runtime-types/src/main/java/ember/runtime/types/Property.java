package ember.runtime.types;

import ember.runtime.EmberNull;
import ember.runtime.EmberValue;

import java.util.Objects;

/**
 * 对象的一个命名属性槽，同时也是属性树（AA-tree）的节点。
 *
 * <p>节点独占它的左右子树；空子树统一指向共享的哨兵节点 {@link PropertyTree#SENTINEL}。
 * 同一名字的属性一旦创建便一直留在树中，因此属性记录的引用身份是稳定的。</p>
 */
public final class Property {

    private final String name;
    private EmberValue value = EmberNull.UNDEFINED;
    private int flags;

    Property left;
    Property right;
    int level;

    /** 创建叶子节点（level 1，两侧子树为哨兵） */
    Property(String name) {
        this.name = name;
        this.left = PropertyTree.SENTINEL;
        this.right = PropertyTree.SENTINEL;
        this.level = 1;
    }

    /** 哨兵：名字为空串，level 0，左右孩子都指向自己 */
    private Property() {
        this.name = "";
        this.left = this;
        this.right = this;
        this.level = 0;
    }

    static Property sentinel() {
        return new Property();
    }

    public String getName() {
        return name;
    }

    public EmberValue getValue() {
        return value;
    }

    public void setValue(EmberValue value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    /**
     * 属性特性位（可写、可枚举等），本层不解释其含义
     */
    public int getFlags() {
        return flags;
    }

    public void setFlags(int flags) {
        this.flags = flags;
    }

    int getLevel() {
        return level;
    }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
