package AutomataKit;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for words given as plain strings, where every character is one symbol.
 */
public final class Words {
    private Words() {
    }

    public static List<String> symbols(String word) {
        List<String> result = new ArrayList<>(word.length());
        word.codePoints().forEach(cp -> result.add(new String(Character.toChars(cp))));
        return result;
    }
}
