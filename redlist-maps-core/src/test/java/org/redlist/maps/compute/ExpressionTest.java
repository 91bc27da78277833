package org.redlist.maps.compute;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.redlist.maps.TestUtils;
import org.redlist.maps.geo.GeoUtils;

class ExpressionTest {

  private static JsonNode json(String text) throws JsonProcessingException {
    return Expression.MAPPER.readTree(text);
  }

  @Test
  void testImageLoadDocument() throws JsonProcessingException {
    Expression expression = Image.load("USGS/SRTMGL1_003").expression();
    assertEquals(json("""
      {
        "result": "0",
        "values": {
          "0": {
            "functionInvocationValue": {
              "functionName": "Image.load",
              "arguments": {"id": {"constantValue": "USGS/SRTMGL1_003"}}
            }
          }
        }
      }
      """), expression.toJson());
  }

  @Test
  void testNestedInvocations() {
    Image image = Image.load("a").select("b1", "b2").mask();
    Expression expression = image.expression();
    assertEquals("Image.mask", expression.functionName());
    Expression select = expression.argument("image");
    assertEquals("Image.select", select.functionName());
    assertEquals("[\"b1\",\"b2\"]", select.argument("bandSelectors").constantValue().toString());
    assertEquals("Image.load", select.argument("input").functionName());
  }

  @Test
  void testNullArgumentsOmitted() {
    Expression expression = Image.load("a").visualize(Visualization.DEFAULT).expression();
    assertNull(expression.argument("min"));
    assertNull(expression.argument("palette"));
    Expression withRange = Image.load("a").visualize(Visualization.of(0, 10, "red")).expression();
    assertEquals(10, withRange.argument("max").constantValue().asDouble());
  }

  @Test
  void testEquality() {
    assertEquals(Image.load("a").mask(), Image.load("a").mask());
    assertEquals(Image.load("a").mask().hashCode(), Image.load("a").mask().hashCode());
    assertNotEquals(Image.load("a").mask(), Image.load("b").mask());
    assertTrue(Expression.constant(1).isConstant());
    assertFalse(Image.constant(1).expression().isConstant());
  }

  @Test
  void testOddArguments() {
    assertThrows(IllegalArgumentException.class, () -> Expression.invoke("Image.load", "id"));
  }

  @Test
  void testClipUsesLonLatMultiPolygon() {
    Expression clip = Image.load("a").clip(TestUtils.SINGAPORE).expression();
    Expression geometry = clip.argument("geometry");
    assertEquals("GeometryConstructors.MultiPolygon", geometry.functionName());
    JsonNode coordinates = geometry.argument("coordinates").constantValue();
    assertEquals(1, coordinates.size());
    assertEquals(103.6, coordinates.get(0).get(0).get(0).get(0).asDouble(), 1e-9);
    assertEquals(1.2, coordinates.get(0).get(0).get(0).get(1).asDouble(), 1e-9);
    assertThrows(IllegalArgumentException.class,
      () -> Geometries.toExpression(GeoUtils.point(1, 2)));
  }
}
