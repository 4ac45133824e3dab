package cfgprep.util;

import java.util.ArrayList;
import java.util.Collection;

/**
 * Class with utility methods...
 */
public class Utils {

	private static final char CONTROL_LIMIT = ' ';
	private static final char PRINTABLE_LIMIT = '~';
	private static final char[] HEX_DIGITS = new char[] { '0', '1', '2', '3', '4', '5', '6', '7', '8', '9', 'a', 'b',
			'c', 'd', 'e', 'f' };

	/**
	 * Return an escaped and quoted version of the passed string.
	 *
	 * Shamelessly copied from http://stackoverflow.com/a/1351973
	 *
	 * @param source passed string
	 * @return escaped version
	 */
	public static String toPrintableRepresentation(String source) {
		if (source == null){
			return null;
		}
		final StringBuilder sb = new StringBuilder();
		char[] hexbuf = null;
		sb.append('"');
		for (int pointer = 0; pointer < source.length(); pointer++) {
			int ch = source.charAt(pointer);
			switch (ch) {
				case '\0': sb.append("\\0"); break;
				case '\t': sb.append("\\t"); break;
				case '\n': sb.append("\\n"); break;
				case '\r': sb.append("\\r"); break;
				case '\"': sb.append("\\\""); break;
				case '\\': sb.append("\\\\"); break;
				default:
					if (CONTROL_LIMIT <= ch && ch <= PRINTABLE_LIMIT) {
						sb.append((char)ch);
					} else {
						sb.append("\\u");
						if (hexbuf == null){
							hexbuf = new char[4];
						}
						for (int offs = 4; offs > 0; ) {
							hexbuf[--offs] = HEX_DIGITS[ch & 0xf];
							ch >>>= 4;
						}
						sb.append(hexbuf, 0, 4);
					}
			}
		}
		return sb.append('"').toString();
	}

	/**
	 * Joins the string representations of several objects.
	 *
	 * @param objs passed objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(Collection<T> objs, String separator){
		StringBuilder builder = new StringBuilder();
		boolean first = true;
		for (T obj : objs){
			if (!first){
				builder.append(separator);
			}
			first = false;
			builder.append(obj);
		}
		return builder.toString();
	}

	@SafeVarargs
	public static <T> ArrayList<T> makeArrayList(T... elements){
		ArrayList<T> ret = new ArrayList<>(elements.length);
		for (T element : elements){
			ret.add(element);
		}
		return ret;
	}

	/**
	 * Addition that saturates at {@link Integer#MAX_VALUE}, which stands for infinity.
	 */
	public static int saturatedAdd(int a, int b){
		long sum = (long) a + b;
		return sum >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) sum;
	}
}
