package euclid.util;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Disjoint sets with path compression and union by rank. Elements are added
 * lazily the first time they are looked at, each in a class of its own.
 */
public class UnionFind<T> {
	private final Map<T, T> predecessorMap;
	private final Map<T, Integer> rank;

	public UnionFind() {
		this.predecessorMap = new HashMap<>();
		this.rank = new HashMap<>();
	}

	private boolean ensurePresence(T element) {
		if (!predecessorMap.containsKey(element)) {
			predecessorMap.put(element, element);
			rank.put(element, 0);
			return false;
		}
		return true;
	}

	public boolean contains(T element) {
		return predecessorMap.containsKey(element);
	}

	public T find(T element) {
		if (!ensurePresence(element)) {
			return element;
		}
		while (true) {
			T parent = predecessorMap.get(element);
			if (parent.equals(element)) {
				return element;
			}
			predecessorMap.put(element, predecessorMap.get(parent));
			element = parent;
		}
	}

	public void union(T u, T v) {
		T uRoot = find(u);
		T vRoot = find(v);
		if (uRoot.equals(vRoot)) {
			return;
		}
		if (rank.get(uRoot) < rank.get(vRoot)) {
			predecessorMap.put(uRoot, vRoot);
		} else if (rank.get(uRoot) > rank.get(vRoot)) {
			predecessorMap.put(vRoot, uRoot);
		} else {
			predecessorMap.put(vRoot, uRoot);
			rank.put(uRoot, rank.get(uRoot) + 1);
		}
	}

	/**
	 * Like comparing the results of {@link #find}, but does not add unknown
	 * elements. An unknown element is only in the same set as itself.
	 */
	public boolean sameSet(T u, T v) {
		if (u.equals(v)) {
			return true;
		}
		if (!contains(u) || !contains(v)) {
			return false;
		}
		return find(u).equals(find(v));
	}

	/**
	 * @return every element known to be in the same set as element, including element itself
	 */
	public List<T> members(T element) {
		List<T> result = new ArrayList<>();
		if (!contains(element)) {
			result.add(element);
			return result;
		}
		T root = find(element);
		for (T candidate : new ArrayList<>(predecessorMap.keySet())) {
			if (find(candidate).equals(root)) {
				result.add(candidate);
			}
		}
		return result;
	}

	public int size() {
		return predecessorMap.size();
	}

}
