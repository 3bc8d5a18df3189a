package im.arun.pagetree.container;

import im.arun.pagetree.exception.BadMethodCallException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FinderMethodTest {

    @Test
    void parse_recognisesEveryFinderShape() {
        FinderMethod findBy = FinderMethod.parse(Navigation.class, "findByLabel");
        assertEquals(FinderKind.ONE, findBy.getKind());
        assertEquals("label", findBy.getProperty());

        FinderMethod findOneBy = FinderMethod.parse(Navigation.class, "findOneById");
        assertEquals(FinderKind.ONE, findOneBy.getKind());
        assertEquals("id", findOneBy.getProperty());

        FinderMethod findAllBy = FinderMethod.parse(Navigation.class, "findAllByClass");
        assertEquals(FinderKind.ALL, findAllBy.getKind());
        assertEquals("class", findAllBy.getProperty());
    }

    @Test
    void parse_keepsPropertyCaseBeyondFirstLetter() {
        assertEquals("cssClass", FinderMethod.parse(Navigation.class, "findAllByCssClass").getProperty());
        assertEquals("URI", FinderMethod.parse(Navigation.class, "findByURI").getProperty());
        assertEquals("x", FinderMethod.parse(Navigation.class, "findByX").getProperty());
    }

    @Test
    void parse_rejectsNonFinderNames() {
        assertThrows(BadMethodCallException.class, () -> FinderMethod.parse(Navigation.class, "findAllBy"));
        assertThrows(BadMethodCallException.class, () -> FinderMethod.parse(Navigation.class, "getLabel"));
        assertThrows(BadMethodCallException.class, () -> FinderMethod.parse(Navigation.class, "xfindByLabel"));
        assertThrows(BadMethodCallException.class, () -> FinderMethod.parse(Navigation.class, null));
    }
}
