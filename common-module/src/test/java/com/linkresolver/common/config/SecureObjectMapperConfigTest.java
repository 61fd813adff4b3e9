package com.linkresolver.common.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SecureObjectMapperConfigTest {
	
	private ObjectMapper objectMapper;
	
	@BeforeEach
	void setUp() {
		SecureObjectMapperConfig config = new SecureObjectMapperConfig();
		objectMapper = config.objectMapper();
	}
	
	@Test
	void testObjectMapper_ValidJson_ShouldDeserialize() throws JsonProcessingException {
		String json = "{\"id\":1,\"name\":\"test\"}";
		TestObject result = objectMapper.readValue(json, TestObject.class);
		
		assertNotNull(result);
		assertEquals(1L, result.getId());
		assertEquals("test", result.getName());
	}
	
	@Test
	void testObjectMapper_UnknownProperties_ShouldThrow() {
		String json = "{\"id\":1,\"name\":\"test\",\"unknownField\":\"value\"}";
		
		assertThrows(Exception.class, () -> objectMapper.readValue(json, TestObject.class));
	}
	
	@Test
	void testObjectMapper_NestedArrays_ShouldParseAsTree() throws JsonProcessingException {
		JsonNode node = objectMapper.readTree("[[\"wrb.fr\",\"Fbv4je\",\"[1,2]\"],[\"di\",10]]");
		
		assertTrue(node.isArray());
		assertEquals("Fbv4je", node.get(0).get(1).asText());
	}
	
	@Test
	void testObjectMapper_PolymorphicDeserialization_ShouldBeDisabled() throws JsonProcessingException {
		String json = "{\"@class\":\"java.util.HashMap\",\"key\":\"value\"}";
		
		Object result = objectMapper.readValue(json, Object.class);
		
		assertTrue(result instanceof Map);
		Map<?, ?> map = (Map<?, ?>) result;
		assertTrue(map.containsKey("@class"));
		assertEquals("java.util.HashMap", map.get("@class"));
	}
	
	private static class TestObject {
		private Long id;
		private String name;
		
		public TestObject() {
		}
		
		public Long getId() {
			return id;
		}
		
		public void setId(Long id) {
			this.id = id;
		}
		
		public String getName() {
			return name;
		}
		
		public void setName(String name) {
			this.name = name;
		}
	}
}
