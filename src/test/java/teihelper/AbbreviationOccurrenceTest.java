package teihelper;

import org.jsoup.nodes.Node;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;

import static org.junit.jupiter.api.Assertions.*;

class AbbreviationOccurrenceTest {

    @Test
    void treeNodesAreNotPartOfThePublicApi() throws NoSuchMethodException {
        for (String name : new String[]{"getElement", "getParent"}) {
            Method accessor = AbbreviationOccurrence.class.getDeclaredMethod(name);
            assertFalse(Modifier.isPublic(accessor.getModifiers()), name);
        }
        for (Method method : AbbreviationOccurrence.class.getMethods()) {
            assertFalse(Node.class.isAssignableFrom(method.getReturnType()), method.getName());
        }
    }
}
