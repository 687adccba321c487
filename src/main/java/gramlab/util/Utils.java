package gramlab.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

import gramlab.Config;

/**
 * Class with utility methods...
 */
public class Utils {

	/**
	 * Joins the string representations of several objects passed via a collection.
	 *
	 * @param strs passed objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(Collection<T> strs, String separator){
		StringBuilder builder = new StringBuilder();
		boolean first = true;
		for (T obj : strs){
			if (!first){
				builder.append(separator);
			}
			builder.append(toString(obj));
			first = false;
		}
		return builder.toString();
	}

	/**
	 * Deterministic string representation: sets are rendered as <code>{a, b}</code> with their
	 * elements sorted by their own representation, lists as <code>[a, b]</code>, everything
	 * else via <code>toString()</code>.
	 */
	public static String toString(Object obj){
		if (obj instanceof String){
			return (String)obj;
		}
		if (obj instanceof Set){
			List<String> strs = new ArrayList<>();
			for (Object elem : (Set<?>)obj){
				strs.add(toString(elem));
			}
			Collections.sort(strs);
			return "{" + String.join(", ", strs) + "}";
		}
		if (obj instanceof List){
			return "[" + join((List<?>)obj, ", ") + "]";
		}
		return String.valueOf(obj);
	}

	/**
	 * Renders the elements in the passed order, enclosed in parentheses.
	 */
	public static <T> String tuple(Collection<T> objs){
		return "(" + join(objs, ", ") + ")";
	}

	/**
	 * Creates a logger whose level is taken from the configuration.
	 */
	public static Logger logger(String name){
		Logger logger = Logger.getLogger(name);
		logger.setLevel(Config.logLevel());
		return logger;
	}

	/**
	 * Splits a word into single character symbols.
	 */
	public static List<String> characters(String word){
		List<String> symbols = new ArrayList<>();
		word.codePoints().forEach(c -> symbols.add(new String(Character.toChars(c))));
		return symbols;
	}
}
