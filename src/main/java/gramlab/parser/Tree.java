package gramlab.parser;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * A parse tree node: a root symbol with ordered children
 */
public final class Tree {

	public final String root;

	public final ImmutableList<Tree> children;

	public Tree(String root, List<Tree> children) {
		this.root = Objects.requireNonNull(root);
		this.children = ImmutableList.copyOf(children);
	}

	public Tree(String root, Tree... children) {
		this(root, Arrays.asList(children));
	}

	public static Tree leaf(String root){
		return new Tree(root, ImmutableList.of());
	}

	public boolean isLeaf(){
		return children.isEmpty();
	}

	/**
	 * Leaf symbols from left to right
	 */
	public List<String> leaves(){
		if (isLeaf()){
			return ImmutableList.of(root);
		}
		ImmutableList.Builder<String> builder = ImmutableList.builder();
		for (Tree child : children){
			builder.addAll(child.leaves());
		}
		return builder.build();
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append("(").append(root);
		if (!isLeaf()){
			builder.append(": ");
			for (int i = 0; i < children.size(); i++){
				if (i > 0){
					builder.append(", ");
				}
				builder.append(children.get(i));
			}
		}
		builder.append(")");
		return builder.toString();
	}

	public String toPrettyString(){
		return toPrettyString("", "\t");
	}

	public String toPrettyString(String indent, String incr){
		StringBuilder builder = new StringBuilder();
		builder.append(indent).append("(").append(root);
		for (Tree child : children){
			builder.append("\n").append(child.toPrettyString(indent + incr, incr));
		}
		builder.append(")");
		return builder.toString();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) return true;
		if (!(obj instanceof Tree)) return false;
		Tree other = (Tree)obj;
		return root.equals(other.root) && children.equals(other.children);
	}

	@Override
	public int hashCode() {
		return Objects.hash(root, children);
	}
}
