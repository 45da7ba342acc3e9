package ember.runtime.types;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 按属性名排序的 AA-tree，用于对象属性的快速查找。
 *
 * <p>AA-tree 的层级不变式：</p>
 * <ul>
 *   <li>叶子节点的 level 为 1</li>
 *   <li>左孩子的 level 恰好比父节点小 1</li>
 *   <li>右孩子的 level 等于父节点或比父节点小 1</li>
 *   <li>右孙子的 level 严格小于祖父节点</li>
 *   <li>level 大于 1 的节点必须有两个孩子</li>
 * </ul>
 *
 * <p>孩子与父节点 level 相同的链接称为水平链接。允许单个右水平链接，
 * 禁止连续的右水平链接和任何左水平链接。{@link #skew} 消除左水平链接，
 * {@link #split} 消除连续的右水平链接。</p>
 *
 * <p>空子树一律指向共享的 {@link #SENTINEL}，遍历只做引用比较，不需要判空。
 * 枚举顺序（{@link #first()} / {@link #next(String)}）是键的字典序，而不是插入顺序。</p>
 *
 * <p>非线程安全：一棵树只属于一个对象，由单个解释器线程修改。</p>
 */
public final class PropertyTree implements Iterable<Property> {

    /** 全局共享的哨兵节点，创建后从不修改 */
    static final Property SENTINEL = Property.sentinel();

    private Property root = SENTINEL;
    private int size;

    // ============ 公共操作 ============

    /**
     * 精确查找
     *
     * @return 名字对应的属性，不存在返回 null
     */
    public Property lookup(String name) {
        Objects.requireNonNull(name, "name");
        return lookup(root, name);
    }

    /**
     * 查找或创建。同名属性已存在时原样返回，树的形状不变。
     *
     * @return 名字对应的属性（永不为 null）
     */
    public Property insert(String name) {
        Objects.requireNonNull(name, "name");
        Property[] result = new Property[1];
        root = insert(root, name, result);
        return result[0];
    }

    /**
     * 键最小的属性，空树返回 null
     */
    public Property first() {
        return lookupFirst(root);
    }

    /**
     * 名字的中序后继。名字不存在或已是最大键时返回 null。
     */
    public Property next(String name) {
        Objects.requireNonNull(name, "name");
        return lookupNext(root, name);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return root == SENTINEL;
    }

    /**
     * 按键序访问每个属性（递归中序遍历，不重新下降）
     */
    @Override
    public void forEach(Consumer<? super Property> action) {
        Objects.requireNonNull(action, "action");
        visit(root, action);
    }

    /**
     * 按键序迭代，每一步都是一次 {@link #next(String)}。
     * 迭代期间插入新属性是允许的，新属性若排在当前位置之后也会被访问到。
     */
    @Override
    public Iterator<Property> iterator() {
        return new Iterator<Property>() {
            private Property nextProp = first();

            @Override
            public boolean hasNext() {
                return nextProp != null;
            }

            @Override
            public Property next() {
                if (nextProp == null) {
                    throw new NoSuchElementException();
                }
                Property current = nextProp;
                nextProp = PropertyTree.this.next(current.getName());
                return current;
            }
        };
    }

    Property root() {
        return root;
    }

    // ============ 树算法 ============

    static Property lookup(Property node, String name) {
        while (node != SENTINEL) {
            int c = name.compareTo(node.getName());
            if (c == 0) {
                return node;
            }
            node = c < 0 ? node.left : node.right;
        }
        return null;
    }

    /**
     * 右旋消除左水平链接，然后沿新的右侧继续处理。哨兵（level 0）上不做任何事。
     */
    static Property skew(Property node) {
        if (node.level != 0) {
            if (node.left.level == node.level) {
                Property save = node;
                node = node.left;
                save.left = node.right;
                node.right = save;
            }
            node.right = skew(node.right);
        }
        return node;
    }

    /**
     * 左旋消除连续的右水平链接并提升 level，然后沿新的右侧继续处理。
     */
    static Property split(Property node) {
        if (node.level != 0 && node.right.right.level == node.level) {
            Property save = node;
            node = node.right;
            save.right = node.left;
            node.left = save;
            node.level++;
            node.right = split(node.right);
        }
        return node;
    }

    /**
     * 递归插入，返回新的子树根；查到或新建的节点写入 result[0]。
     * 回溯时对路径上的每个节点依次 skew、split。
     */
    private Property insert(Property node, String name, Property[] result) {
        if (node == SENTINEL) {
            size++;
            return result[0] = new Property(name);
        }
        int c = name.compareTo(node.getName());
        if (c < 0) {
            node.left = insert(node.left, name, result);
        } else if (c > 0) {
            node.right = insert(node.right, name, result);
        } else {
            return result[0] = node;
        }
        node = skew(node);
        node = split(node);
        return node;
    }

    static Property lookupFirst(Property node) {
        if (node == SENTINEL) {
            return null;
        }
        while (node.left != SENTINEL) {
            node = node.left;
        }
        return node;
    }

    /**
     * 节点没有父指针，所以从根重新下降并记录路径。
     * 找到的节点有右子树时，后继是右子树的最小节点；否则沿路径回溯，
     * 第一个不是经由其右孩子到达的祖先就是后继。
     */
    static Property lookupNext(Property node, String name) {
        Deque<Property> path = new ArrayDeque<>();
        while (node != SENTINEL) {
            int c = name.compareTo(node.getName());
            if (c == 0) {
                break;
            }
            path.push(node);
            node = c < 0 ? node.left : node.right;
        }
        if (node == SENTINEL) {
            return null;
        }
        if (node.right != SENTINEL) {
            return lookupFirst(node.right);
        }
        Property parent = path.poll();
        while (parent != null && node == parent.right) {
            node = parent;
            parent = path.poll();
        }
        return parent;
    }

    private static void visit(Property node, Consumer<? super Property> action) {
        if (node.left != SENTINEL) visit(node.left, action);
        action.accept(node);
        if (node.right != SENTINEL) visit(node.right, action);
    }

    // ============ 不变式校验（测试用） ============

    /**
     * 校验整棵树的五条层级不变式，违反时抛出 IllegalStateException
     */
    void checkInvariants() {
        checkNode(root);
    }

    private static void checkNode(Property node) {
        if (node == SENTINEL) {
            return;
        }
        if (node.left == SENTINEL && node.right == SENTINEL && node.level != 1) {
            throw violation(node, "leaf level must be 1");
        }
        if (node.left != SENTINEL && node.left.level != node.level - 1) {
            throw violation(node, "left child level must be parent level - 1");
        }
        if (node.right != SENTINEL
                && node.right.level != node.level && node.right.level != node.level - 1) {
            throw violation(node, "right child level must be parent level or parent level - 1");
        }
        if (node.right != SENTINEL && node.right.right != SENTINEL
                && node.right.right.level >= node.level) {
            throw violation(node, "right grandchild level must be below grandparent");
        }
        if (node.level > 1 && (node.left == SENTINEL || node.right == SENTINEL)) {
            throw violation(node, "node above level 1 must have two children");
        }
        checkNode(node.left);
        checkNode(node.right);
    }

    private static IllegalStateException violation(Property node, String rule) {
        return new IllegalStateException(rule + " (node '" + node.getName() + "', level " + node.level + ")");
    }
}
