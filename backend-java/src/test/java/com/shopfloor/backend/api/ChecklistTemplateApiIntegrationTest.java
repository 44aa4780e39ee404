package com.shopfloor.backend.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.jayway.jsonpath.JsonPath;

@SpringBootTest
@AutoConfigureMockMvc
class ChecklistTemplateApiIntegrationTest {

  @Autowired
  private MockMvc mockMvc;

  private long create(String body) throws Exception {
    String resp = mockMvc.perform(post("/v1/checklist-templates")
            .contentType(MediaType.APPLICATION_JSON)
            .content(body))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").exists())
        .andReturn().getResponse().getContentAsString();
    return ((Number) JsonPath.read(resp, "$.id")).longValue();
  }

  @Test
  void createGetUpdate() throws Exception {
    long id = create("""
        {"name":"Final assembly","description":"before shipping",
         "applicableToStages":["assembly"],
         "sections":[{"name":"Visual","items":[
           {"description":"Paint without runs","type":"boolean","criticalItem":true,"required":true},
           {"description":"Overall length","type":"numeric","expectedValue":1200,"tolerance":2,"unit":"mm"}]}]}
        """);

    mockMvc.perform(get("/v1/checklist-templates/{id}", id))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Final assembly"))
        .andExpect(jsonPath("$.active").value(true))
        .andExpect(jsonPath("$.applicableToStages[0]").value("assembly"))
        .andExpect(jsonPath("$.sections[0].id").isNotEmpty())
        .andExpect(jsonPath("$.sections[0].items[0].id").isNotEmpty())
        .andExpect(jsonPath("$.sections[0].items[0].type").value("boolean"))
        .andExpect(jsonPath("$.sections[0].items[1].tolerance").value(2.0));

    mockMvc.perform(put("/v1/checklist-templates/{id}", id)
            .contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"name":"Final assembly v2","active":false,"sections":[]}
                """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Final assembly v2"))
        .andExpect(jsonPath("$.active").value(false));

    String active = mockMvc.perform(get("/v1/checklist-templates").param("active_only", "true"))
        .andExpect(status().isOk())
        .andReturn().getResponse().getContentAsString();
    assertThat(JsonPath.<List<Object>>read(active, "$[*].id")).doesNotContain((int) id);

    mockMvc.perform(get("/v1/checklist-templates"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].name", hasItem("Final assembly v2")));
  }

  @Test
  void listCountsItems() throws Exception {
    create("""
        {"name":"Counting","sections":[
          {"id":"a","name":"A","items":[{"id":"1","description":"x","type":"text","criticalItem":true}]},
          {"id":"b","name":"B","items":[{"id":"2","description":"y","type":"boolean"},{"id":"3","description":"z","type":"boolean"}]}]}
        """);

    mockMvc.perform(get("/v1/checklist-templates"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@.name=='Counting')].itemCount", hasItem(3)))
        .andExpect(jsonPath("$[?(@.name=='Counting')].sectionCount", hasItem(2)))
        .andExpect(jsonPath("$[?(@.name=='Counting')].criticalItemCount", hasItem(1)));
  }

  @Test
  void invalidTemplatesAreRejected() throws Exception {
    mockMvc.perform(post("/v1/checklist-templates")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"name\":\"  \"}"))
        .andExpect(status().isBadRequest());

    mockMvc.perform(post("/v1/checklist-templates")
            .contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"name":"Bad type","sections":[{"name":"S","items":[{"description":"x","type":"colour"}]}]}
                """))
        .andExpect(status().isBadRequest());

    mockMvc.perform(post("/v1/checklist-templates")
            .contentType(MediaType.APPLICATION_JSON)
            .content("""
                {"name":"No type","sections":[{"name":"S","items":[{"description":"x"}]}]}
                """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.detail", not("")));
  }

  @Test
  void unknownTemplateIs404() throws Exception {
    mockMvc.perform(get("/v1/checklist-templates/{id}", 987654))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.detail").value("checklist template not found"));
  }
}
